// file: src/main/java/io/crdtlite/replica/ClockMode.java
package io.crdtlite.replica;

/** How a replica orders its own edits. */
public enum ClockMode {
    /** Per-session logical clock; replicas edit concurrently. */
    LOGICAL,
    /** Single server-ordered session; every edit is stamped by the server clock. */
    SERVER
}
