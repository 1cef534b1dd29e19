package com.shapeml.shape;

import java.util.Objects;

import org.joml.Vector4d;

/** Surface description carried by every shape and inherited by its offspring. */
public final class Material {
    private String name = "";
    private final Vector4d color = new Vector4d(0.6, 0.6, 0.6, 1.0);
    private double metallic = 0.0;
    private double roughness = 1.0;
    private double reflectance = 0.5;
    private String texture = "";

    public Material() {}

    public Material copy() {
        Material m = new Material();
        m.name = name;
        m.color.set(color);
        m.metallic = metallic;
        m.roughness = roughness;
        m.reflectance = reflectance;
        m.texture = texture;
        return m;
    }

    public String name() { return name; }
    public void setName(String name) { this.name = name == null ? "" : name; }

    /** RGBA in [0, 1]. */
    public Vector4d color() { return new Vector4d(color); }
    public void setColor(Vector4d c) { color.set(c); }

    public double metallic() { return metallic; }
    public void setMetallic(double metallic) { this.metallic = metallic; }

    public double roughness() { return roughness; }
    public void setRoughness(double roughness) { this.roughness = roughness; }

    public double reflectance() { return reflectance; }
    public void setReflectance(double reflectance) { this.reflectance = reflectance; }

    /** Path of the diffuse texture, empty when there is none. */
    public String texture() { return texture; }
    public void setTexture(String texture) { this.texture = texture == null ? "" : texture; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Material)) return false;
        Material other = (Material) o;
        return name.equals(other.name)
                && color.equals(other.color)
                && metallic == other.metallic
                && roughness == other.roughness
                && reflectance == other.reflectance
                && texture.equals(other.texture);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, color, metallic, roughness, reflectance, texture);
    }
}
