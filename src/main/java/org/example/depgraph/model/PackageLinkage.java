package org.example.depgraph.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Describes how a dependency is attached to the package that depends on it.
 */
public enum PackageLinkage {

    /** A dependency linked dynamically, e.g. a jar on the classpath. */
    DYNAMIC,

    /** A dependency whose code is statically bundled into the dependent package. */
    STATIC,

    /** A sub-project of the analyzed project, linked dynamically. */
    PROJECT_DYNAMIC,

    /** A sub-project of the analyzed project, linked statically. */
    PROJECT_STATIC;

    /**
     * The linkages that mark a dependency as a sub-project rather than an external package.
     */
    public static final Set<PackageLinkage> PROJECT_LINKAGE =
            Collections.unmodifiableSet(EnumSet.of(PROJECT_DYNAMIC, PROJECT_STATIC));

    /**
     * Returns whether this linkage denotes a sub-project.
     */
    public boolean isProjectLinkage() {
        return PROJECT_LINKAGE.contains(this);
    }
}
