package com.shapeml.geometry;

import java.util.ArrayList;
import java.util.List;

import org.joml.Vector3d;

/**
 * Loose octree over axis-aligned boxes. Cells extend half their width beyond their
 * nominal bounds, so an element descends as long as it fits into a loose child cell.
 *
 * @param <T> payload stored with each box
 */
public final class Octree<T> {

    public static final double DEFAULT_HALF_WIDTH = 1000.0;
    static final int MAX_LEVEL = 15;

    private static final class Entry<T> {
        final Aabb box;
        final T payload;

        Entry(Aabb box, T payload) {
            this.box = box;
            this.payload = payload;
        }
    }

    private final Vector3d center;
    private final double halfWidth;
    private final int level;
    @SuppressWarnings("unchecked")
    private final Octree<T>[] children = new Octree[8];
    private final List<Entry<T>> objects = new ArrayList<>();

    public Octree(Vector3d center, double halfWidth) {
        this(center, halfWidth, 0);
    }

    private Octree(Vector3d center, double halfWidth, int level) {
        this.center = new Vector3d(center);
        this.halfWidth = halfWidth;
        this.level = level;
    }

    /** Inserts an element; it is assumed to lie inside the root cell. */
    public void insert(Aabb box, T payload) {
        insertRec(new Entry<>(box, payload));
    }

    private void insertRec(Entry<T> e) {
        int index = 0;
        boolean straddle = false;
        double loose = 0.5 * halfWidth;
        for (int i = 0; i < 3; i++) {
            double delta = e.box.center.get(i) - center.get(i);
            if (Math.abs(delta) + loose <= e.box.extent.get(i)) {
                straddle = true;
                break;
            }
            if (delta > 0.0) index |= 1 << i;
        }

        if (!straddle && level < MAX_LEVEL) {
            if (children[index] == null) {
                double step = 0.5 * halfWidth;
                Vector3d offset = new Vector3d(
                        (index & 1) != 0 ? step : -step,
                        (index & 2) != 0 ? step : -step,
                        (index & 4) != 0 ? step : -step);
                children[index] = new Octree<>(offset.add(center), step, level + 1);
            }
            children[index].insertRec(e);
        } else {
            objects.add(e);
        }
    }

    /** Payloads whose boxes overlap {@code box}. */
    public List<T> query(Aabb box) {
        List<T> out = new ArrayList<>();
        queryRec(box, box.min(), box.max(), out);
        return out;
    }

    private void queryRec(Aabb box, Vector3d min, Vector3d max, List<T> out) {
        for (Entry<T> e : objects) {
            if (box.intersects(e.box)) out.add(e.payload);
        }
        double loose = 0.5 * halfWidth;
        for (int i = 0; i < 8; i++) {
            if (children[i] == null) continue;
            boolean overlaps = true;
            for (int j = 0; j < 3 && overlaps; j++) {
                if (((i >> j) & 1) != 0) {
                    overlaps = max.get(j) >= center.get(j) - loose;
                } else {
                    overlaps = min.get(j) <= center.get(j) + loose;
                }
            }
            if (overlaps) children[i].queryRec(box, min, max, out);
        }
    }

    public int size() {
        int n = objects.size();
        for (Octree<T> c : children) {
            if (c != null) n += c.size();
        }
        return n;
    }
}
