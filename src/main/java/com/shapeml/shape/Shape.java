package com.shapeml.shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.joml.Matrix3d;
import org.joml.Matrix4d;
import org.joml.Quaterniond;
import org.joml.Vector3d;
import org.joml.Vector4d;

import com.shapeml.geometry.Aabb;
import com.shapeml.geometry.Mesh;
import com.shapeml.geometry.Obb;
import com.shapeml.geometry.Plane;
import com.shapeml.script.parser.Rule;
import com.shapeml.script.parser.Value;

/**
 * A node of the derivation tree: a scope (rigid transform plus size), an optional
 * mesh, a material and the bookkeeping the interpreter needs while deriving.
 *
 * Shapes live in a {@link ShapeTree} and refer to their parent and children by id.
 * A shape that is not attached yet (id -1) still knows its parent, so working copies
 * on the scope stack can resolve world transforms before they are appended.
 *
 * Meshes are shared between shapes and never modified in place: every geometry
 * change copies the mesh first and installs the copy.
 */
public final class Shape {

    private static final double FACE_SPLIT_THRESHOLD = Math.cos(Math.toRadians(90.0 - 78.75));

    private final ShapeTree tree;
    private int id = -1;
    private int parentId;
    private final List<Integer> childIds = new ArrayList<>();

    private String name = "";
    private Mesh mesh;
    private final Matrix4d trafo = new Matrix4d();
    private final Vector3d size = new Vector3d(1.0, 1.0, 1.0);
    private Material material = new Material();

    private int ffdL;
    private int ffdM;
    private int ffdN;
    private List<Vector3d> ffdCps = new ArrayList<>();

    private final Map<String, Value> customAttributes = new LinkedHashMap<>();
    private List<Value> parameters = Collections.emptyList();
    private Rule rule;

    private boolean visible = true;
    private boolean terminal = false;
    private int index = -1;

    private boolean hasTextureProjection = false;
    private final Matrix4d textureProjection = new Matrix4d();
    private final List<Plane> trimPlanes = new ArrayList<>();

    Shape(ShapeTree tree, int parentId) {
        this.tree = tree;
        this.parentId = parentId;
        ffdReset(1, 1, 1);
    }

    private Shape(Shape other) {
        this.tree = other.tree;
        this.parentId = other.parentId;
        this.name = other.name;
        this.mesh = other.mesh;
        this.trafo.set(other.trafo);
        this.size.set(other.size);
        this.material = other.material.copy();
        this.ffdL = other.ffdL;
        this.ffdM = other.ffdM;
        this.ffdN = other.ffdN;
        this.ffdCps = new ArrayList<>(other.ffdCps.size());
        for (Vector3d cp : other.ffdCps) ffdCps.add(new Vector3d(cp));
        this.customAttributes.putAll(other.customAttributes);
        this.parameters = other.parameters;
        this.rule = other.rule;
        this.visible = other.visible;
        this.terminal = other.terminal;
        this.index = other.index;
        this.hasTextureProjection = other.hasTextureProjection;
        this.textureProjection.set(other.textureProjection);
        this.trimPlanes.addAll(other.trimPlanes);
    }

    // -------------------------
    // Tree structure
    // -------------------------

    /** Detached copy with the same parent, used for the scope stack and for split pieces. */
    public Shape copy() {
        return new Shape(this);
    }

    /**
     * Detached child template of this shape: inherits everything but the transform delta,
     * the rule, the texture projection and the trim planes.
     */
    public Shape createOffspring() {
        if (id < 0) throw new IllegalStateException("Shape '" + name + "' is not part of a tree");
        Shape ret = new Shape(this);
        ret.trafo.identity();
        ret.parentId = id;
        ret.rule = null;
        ret.hasTextureProjection = false;
        ret.trimPlanes.clear();
        return ret;
    }

    /** Attaches this shape to the tree as the last child of its parent. */
    public void appendToParent() {
        tree.attach(this);
    }

    void assignId(int newId) {
        this.id = newId;
    }

    void addChildId(int childId) {
        childIds.add(childId);
    }

    public ShapeTree tree() { return tree; }

    /** Arena id, or -1 for a detached shape. */
    public int id() { return id; }

    public boolean isAttached() { return id >= 0; }

    public Shape parent() {
        return parentId < 0 ? null : tree.get(parentId);
    }

    public List<Shape> children() {
        List<Shape> out = new ArrayList<>(childIds.size());
        for (int c : childIds) out.add(tree.get(c));
        return out;
    }

    public boolean isLeaf() { return childIds.isEmpty(); }

    public int depth() {
        int depth = 0;
        Shape s = parent();
        while (s != null) {
            depth++;
            s = s.parent();
        }
        return depth;
    }

    /** True when {@code shape} is this shape or one of its ancestors. */
    public boolean isAncestor(Shape shape) {
        if (shape == null) return false;
        for (Shape s = this; s != null; s = s.parent()) {
            if (s == shape) return true;
        }
        return false;
    }

    /** Pre-order walk over this shape and its attached descendants. */
    public void accept(ShapeVisitor visitor) {
        tree.walk(this, visitor);
    }

    // -------------------------
    // Plain properties
    // -------------------------

    public String name() { return name; }
    public void setName(String name) { this.name = name; }

    public Mesh mesh() { return mesh; }
    public void setMesh(Mesh mesh) { this.mesh = mesh; }
    public boolean hasNonEmptyMesh() { return mesh != null && !mesh.isEmpty(); }

    public Material material() { return material; }

    public boolean visible() { return visible; }
    public void setVisible(boolean visible) { this.visible = visible; }

    public boolean terminal() { return terminal; }
    public void setTerminal(boolean terminal) { this.terminal = terminal; }

    /** Position within the last repeat or split, -1 when unset. */
    public int index() { return index; }
    public void setIndex(int index) { this.index = index; }

    public Rule rule() { return rule; }
    public void setRule(Rule rule) { this.rule = rule; }

    public List<Value> parameters() { return parameters; }
    public void setParameters(List<Value> parameters) {
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    /** Value bound to the rule argument {@code argName}, or null. */
    public Value getParameter(String argName) {
        if (rule == null) return null;
        List<String> names = rule.params;
        for (int i = 0; i < names.size() && i < parameters.size(); i++) {
            if (names.get(i).equals(argName)) return parameters.get(i);
        }
        return null;
    }

    public Value getCustomAttribute(String attrName) {
        return customAttributes.get(attrName);
    }

    /** Inserts or overwrites a custom attribute. */
    public void setCustomAttribute(String attrName, Value value) {
        customAttributes.put(attrName, value);
    }

    public Map<String, Value> customAttributes() {
        return Collections.unmodifiableMap(customAttributes);
    }

    // -------------------------
    // Scope
    // -------------------------

    public Matrix4d trafo() { return new Matrix4d(trafo); }

    public Vector3d position() { return trafo.getTranslation(new Vector3d()); }

    public Matrix3d rotation() { return trafo.get3x3(new Matrix3d()); }

    public Quaterniond rotationAsQuaternion() {
        return new Quaterniond().setFromNormalized(rotation());
    }

    public Vector3d size() { return new Vector3d(size); }
    public double sizeX() { return size.x; }
    public double sizeY() { return size.y; }
    public double sizeZ() { return size.z; }

    public void setSize(Vector3d s) { size.set(s); }
    public void setSizeX(double x) { size.x = x; }
    public void setSizeY(double y) { size.y = y; }
    public void setSizeZ(double z) { size.z = z; }

    public void scale(Vector3d s) { size.mul(s); }
    public void scaleX(double x) { size.x *= x; }
    public void scaleY(double y) { size.y *= y; }
    public void scaleZ(double z) { size.z *= z; }

    /** Moves the scope along its own axes. */
    public void translate(Vector3d t) { trafo.translate(t); }
    public void translateX(double x) { trafo.translate(x, 0.0, 0.0); }
    public void translateY(double y) { trafo.translate(0.0, y, 0.0); }
    public void translateZ(double z) { trafo.translate(0.0, 0.0, z); }

    /** Rotates the scope about a local axis, angle in degrees. */
    public void rotate(Vector3d axis, double angle) {
        trafo.rotate(Math.toRadians(angle), new Vector3d(axis).normalize());
    }

    public void rotateX(double angle) { trafo.rotateX(Math.toRadians(angle)); }
    public void rotateY(double angle) { trafo.rotateY(Math.toRadians(angle)); }
    public void rotateZ(double angle) { trafo.rotateZ(Math.toRadians(angle)); }

    /** Replaces the rotational part; the matrix is orthonormalized first. */
    public void setRotation(Matrix3d rot) {
        Quaterniond q = new Quaterniond().setFromUnnormalized(rot).normalize();
        trafo.set3x3(new Matrix3d().set(q));
    }

    /** Transform from the scope frame to world space. */
    public Matrix4d worldTrafo() {
        Shape p = parent();
        if (p == null) return new Matrix4d(trafo);
        return p.worldTrafo().mul(trafo);
    }

    public Vector3d worldPosition() {
        return worldTrafo().getTranslation(new Vector3d());
    }

    public Aabb worldAabb() {
        Matrix4d w = worldTrafo();
        List<Vector3d> corners = new ArrayList<>(8);
        for (int i = 0; i < 8; i++) {
            Vector3d c = new Vector3d((i & 1) != 0 ? size.x : 0.0, (i & 2) != 0 ? size.y : 0.0,
                    (i & 4) != 0 ? size.z : 0.0);
            corners.add(w.transformPosition(c));
        }
        return Aabb.of(corners);
    }

    public Obb worldObb() {
        Matrix4d w = worldTrafo();
        Matrix3d rot = w.get3x3(new Matrix3d());
        Vector3d[] axes = new Vector3d[3];
        for (int i = 0; i < 3; i++) axes[i] = rot.getColumn(i, new Vector3d());
        Vector3d extent = new Vector3d(size).mul(0.5);
        Vector3d center = rot.transform(new Vector3d(extent)).add(w.getTranslation(new Vector3d()));
        return new Obb(center, axes, extent);
    }

    /** Moves the scope so that its center matches {@code other}'s along the selected axes. */
    public void centerInOtherShape(Shape other, boolean x, boolean y, boolean z) {
        Matrix4d world = worldTrafo();
        Matrix4d otherWorld = other.worldTrafo();
        Vector3d center = world.transformPosition(new Vector3d(size).mul(0.5));
        Vector3d centerInOther = otherWorld.invertAffine(new Matrix4d()).transformPosition(center);
        Vector3d diff = new Vector3d(other.size).mul(0.5).sub(centerInOther);
        diff.set(x ? diff.x : 0.0, y ? diff.y : 0.0, z ? diff.z : 0.0);
        Matrix3d toLocal = world.get3x3(new Matrix3d()).transpose().mul(otherWorld.get3x3(new Matrix3d()));
        translate(toLocal.transform(diff));
    }

    // -------------------------
    // Mesh and scope
    // -------------------------

    /** Installs a mesh that is stretched into the current scope; zero sizes are derived from the mesh. */
    public void setMeshIntoScope(Mesh m) {
        mesh = m;
        Vector3d dim = new Vector3d(m.aabb().extent).mul(2.0);
        Vector3d scale = new Vector3d(
                dim.x == 0.0 ? 1.0 : size.x / dim.x,
                dim.y == 0.0 ? 1.0 : size.y / dim.y,
                dim.z == 0.0 ? 1.0 : size.z / dim.z);
        boolean zx = size.x == 0.0;
        boolean zy = size.y == 0.0;
        boolean zz = size.z == 0.0;
        if (zx && zy && zz) {
            size.set(dim);
        } else if (zx && zy) {
            size.set(dim).mul(scale.z);
        } else if (zx && zz) {
            size.set(dim).mul(scale.y);
        } else if (zy && zz) {
            size.set(dim).mul(scale.x);
        } else if (zx) {
            size.x = dim.x * (scale.y + scale.z) * 0.5;
        } else if (zy) {
            size.y = dim.y * (scale.x + scale.z) * 0.5;
        } else if (zz) {
            size.z = dim.z * (scale.x + scale.y) * 0.5;
        }
    }

    /** Installs a mesh given in scope coordinates and fits the scope to its bounding box. */
    public void setMeshAndAdaptScope(Mesh m) {
        mesh = m;
        Aabb box = m.aabb();
        translate(box.min());
        Vector3d s = new Vector3d(box.extent).mul(2.0);
        for (int i = 0; i < 3; i++) {
            if (s.get(i) < Mesh.EPSILON) s.setComponent(i, 0.0);
        }
        size.set(s);
    }

    /** Like {@link #setMeshAndAdaptScope} after rotating the scope by {@code rot}. */
    public void setMeshAndAdaptScopeWithRotation(Mesh m, Matrix3d rot) {
        Matrix3d linear = trafo.get3x3(new Matrix3d()).mul(rot);
        trafo.set3x3(linear);
        setMeshAndAdaptScope(m);
    }

    /** Installs a single split-off face, aligning the scope z axis with its normal. */
    public void setMeshAfterFaceSplit(Mesh m, Vector3d normal) {
        double dot = normal.y;
        Vector3d yAxis;
        if (dot > FACE_SPLIT_THRESHOLD) {
            yAxis = new Vector3d(0.0, 0.0, -1.0);
        } else if (dot < -FACE_SPLIT_THRESHOLD) {
            yAxis = new Vector3d(0.0, 0.0, 1.0);
        } else {
            yAxis = new Vector3d(0.0, 1.0, 0.0);
        }
        Vector3d xAxis = new Vector3d(yAxis).cross(normal).normalize();
        yAxis = new Vector3d(normal).cross(xAxis).normalize();
        Matrix3d rot = new Matrix3d();
        rot.setRow(0, xAxis);
        rot.setRow(1, yAxis);
        rot.setRow(2, normal);
        m.transform(new Matrix4d(rot), new Vector3d(1.0, 1.0, 1.0));
        setMeshAndAdaptScopeWithRotation(m, rot.transpose(new Matrix3d()));
    }

    /** Rotates the scope about a local axis while keeping the mesh where it is in world space. */
    public void rotateScope(Vector3d axis, double angle) {
        Matrix3d rot = new Matrix3d().rotation(Math.toRadians(angle), new Vector3d(axis).normalize());
        Mesh tmp = mesh.copy();
        Mesh.UnitTrafo ut = tmp.scaledUnitTrafo(size);
        Matrix4d inverse = new Matrix4d(rot.transpose(new Matrix3d()));
        tmp.transform(inverse.mul(new Matrix4d().translation(ut.translation)), ut.scale);
        setMeshAndAdaptScopeWithRotation(tmp, rot);
    }

    /** Turns a scope lying in the xy plane into one lying in the xz plane. */
    public void rotateScopeXYToXZ() {
        translateY(size.y);
        rotateX(90.0);
        double z = size.z;
        size.z = size.y;
        size.y = z;
        if (hasNonEmptyMesh()) {
            Mesh tmp = mesh.copy();
            tmp.transform(new Matrix4d().rotationX(-0.5 * Math.PI), new Vector3d(1.0, 1.0, 1.0));
            setMeshIntoScope(tmp);
        }
    }

    // -------------------------
    // Free-form deformation
    // -------------------------

    /** Resets the deformation cage to an undeformed lattice with the given resolution. */
    public void ffdReset(int l, int m, int n) {
        if (l <= 0 || m <= 0 || n <= 0) throw new IllegalArgumentException("FFD resolution must be positive");
        ffdL = l;
        ffdM = m;
        ffdN = n;
        ffdCps = new ArrayList<>((l + 1) * (m + 1) * (n + 1));
        for (int k = 0; k <= n; k++) {
            for (int j = 0; j <= m; j++) {
                for (int i = 0; i <= l; i++) {
                    ffdCps.add(new Vector3d((double) i / l, (double) j / m, (double) k / n));
                }
            }
        }
    }

    public int[] ffdResolution() {
        return new int[] { ffdL, ffdM, ffdN };
    }

    public List<Vector3d> ffdControlPoints() {
        List<Vector3d> out = new ArrayList<>(ffdCps.size());
        for (Vector3d cp : ffdCps) out.add(new Vector3d(cp));
        return out;
    }

    /** Moves one control point by {@code t}, given in scope units. */
    public void ffdTranslate(int i, int j, int k, Vector3d t) {
        if (i > ffdL || j > ffdM || k > ffdN) {
            throw new IllegalArgumentException("Control point (" + i + ", " + j + ", " + k + ") is outside the cage");
        }
        Vector3d rel = new Vector3d(t).div(size);
        ffdCps.get(i + (ffdL + 1) * j + (ffdL + 1) * (ffdM + 1) * k).add(rel);
    }

    /** Deforms the mesh with the current cage and resets the cage. */
    public void ffdApply() {
        List<Vector3d> cps = new ArrayList<>(ffdCps.size());
        for (Vector3d cp : ffdCps) cps.add(new Vector3d(cp).mul(size));
        Mesh tmp = mesh.copy();
        tmp.transformUnitTrafoAndScale(new Vector3d(1.0, 1.0, 1.0));
        tmp.transformFFD(cps, ffdL, ffdM, ffdN);
        setMeshAndAdaptScope(tmp);
        ffdReset(ffdL, ffdM, ffdN);
    }

    // -------------------------
    // Texturing
    // -------------------------

    public boolean hasTextureProjection() { return hasTextureProjection; }

    /** Projection that maps scope xy coordinates to uv, tiled every {@code width} by {@code height}. */
    public void textureSetupProjectionInXY(double width, double height, double uOffset, double vOffset) {
        textureProjection.identity().scale(1.0 / width, 1.0 / height, 0.0).translate(uOffset, vOffset, 0.0);
        hasTextureProjection = true;
    }

    /**
     * Assigns uvs by projecting the mesh with the nearest projection set on this shape or an
     * ancestor. Returns false when there is no such projection.
     */
    public boolean textureProjectUV() {
        Matrix4d t = new Matrix4d().scaling(size);
        Shape it = this;
        while (it != null && !it.hasTextureProjection) {
            t = new Matrix4d(it.trafo).mul(t);
            it = it.parent();
        }
        if (it == null) return false;
        t = new Matrix4d(it.textureProjection).mul(t);
        Mesh tmp = mesh.copy();
        tmp.texProjectUVInUnitXY(t);
        mesh = tmp;
        return true;
    }

    // -------------------------
    // Trimming
    // -------------------------

    public void addTrimPlane(Plane plane) {
        trimPlanes.add(plane);
    }

    public List<Plane> trimPlanes() {
        return Collections.unmodifiableList(trimPlanes);
    }

    /** Cuts the mesh with the own trim planes and, unless {@code localOnly}, those of all ancestors. */
    public void trim(boolean localOnly) {
        List<Plane> planes = new ArrayList<>(trimPlanes);
        if (!localOnly) {
            Matrix4d t = trafo.invertAffine(new Matrix4d());
            for (Shape it = parent(); it != null; it = it.parent()) {
                for (Plane p : it.trimPlanes) planes.add(p.transform(t));
                t.mul(it.trafo.invertAffine(new Matrix4d()));
            }
        }
        Mesh tmp = mesh.copy();
        tmp.transformUnitTrafoAndScale(size);
        for (Plane p : planes) {
            Mesh.Split split = tmp.split(p);
            if (split.below.isEmpty()) break;
            tmp = split.below;
        }
        setMeshAndAdaptScope(tmp);
    }

    // -------------------------
    // Printing
    // -------------------------

    private static String vec(double... c) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < c.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(Value.formatGeneral(c[i]));
        }
        return sb.append(')').toString();
    }

    /** One-line summary used by the tree dump. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("name: \"").append(name).append('"');
        if (index >= 0) sb.append("; index: ").append(index);

        Vector3d pos = position();
        Quaterniond q = rotationAsQuaternion();
        sb.append("; scope position: ").append(vec(pos.x, pos.y, pos.z));
        sb.append("; scope rotation: ").append(vec(q.x, q.y, q.z)).append(", ").append(Value.formatGeneral(q.w));
        sb.append("; scope size: ").append(vec(size.x, size.y, size.z));

        sb.append("; mesh: ").append(mesh != null ? "yes" : "no");
        sb.append("; visible: ").append(visible ? "yes" : "no");
        sb.append("; terminal: ").append(terminal ? "yes" : "no");

        if (!material.name().isEmpty()) sb.append("; material name: \"").append(material.name()).append('"');
        Vector4d c = material.color();
        sb.append("; material color: ").append(vec(c.x, c.y, c.z, c.w));
        sb.append("; material metallic: ").append(Value.formatGeneral(material.metallic()));
        sb.append("; material roughness: ").append(Value.formatGeneral(material.roughness()));
        if (!material.texture().isEmpty()) sb.append("; material texture: \"").append(material.texture()).append('"');
        return sb.append('.').toString();
    }
}
