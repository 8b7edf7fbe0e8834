package org.example.depgraph.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identifies a resolved package.
 * Consists of the package manager type, namespace, name and version.
 *
 * <p>Identifiers are ordered lexicographically by type, namespace, name and version.</p>
 */
public final class Identifier implements Comparable<Identifier> {

    private static final Comparator<Identifier> ORDER = Comparator
            .comparing(Identifier::getType)
            .thenComparing(Identifier::getNamespace)
            .thenComparing(Identifier::getName)
            .thenComparing(Identifier::getVersion);

    private final String type;
    private final String namespace;
    private final String name;
    private final String version;

    /**
     * Creates a new Identifier.
     *
     * @param type      the type of the package manager, e.g. "Maven" or "NPM"
     * @param namespace the namespace of the package, e.g. a Maven groupId (may be empty)
     * @param name      the name of the package
     * @param version   the resolved version of the package
     */
    public Identifier(String type, String namespace, String name, String version) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.namespace = Objects.requireNonNull(namespace, "namespace cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.version = Objects.requireNonNull(version, "version cannot be null");
    }

    /**
     * Parses an Identifier from its coordinates in the form {@code type:namespace:name:version}.
     * Missing trailing components are treated as empty strings.
     *
     * @param coordinates the coordinates string
     * @return the parsed Identifier
     * @throws IllegalArgumentException if coordinates are blank
     */
    public static Identifier fromCoordinates(String coordinates) {
        if (coordinates == null || coordinates.trim().isEmpty()) {
            throw new IllegalArgumentException("Coordinates cannot be null or empty");
        }

        String[] parts = coordinates.trim().split(":", 4);
        return new Identifier(
                part(parts, 0),
                part(parts, 1),
                part(parts, 2),
                part(parts, 3)
        );
    }

    private static String part(String[] parts, int index) {
        return index < parts.length ? parts[index] : "";
    }

    // Getters

    public String getType() {
        return type;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    /**
     * Returns the coordinates of this Identifier in the form {@code type:namespace:name:version}.
     */
    public String toCoordinates() {
        return type + ":" + namespace + ":" + name + ":" + version;
    }

    @Override
    public int compareTo(Identifier other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identifier that = (Identifier) o;
        return type.equals(that.type) &&
               namespace.equals(that.namespace) &&
               name.equals(that.name) &&
               version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, namespace, name, version);
    }

    @Override
    public String toString() {
        return toCoordinates();
    }
}
