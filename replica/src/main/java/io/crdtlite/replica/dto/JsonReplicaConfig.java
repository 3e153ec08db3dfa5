package io.crdtlite.replica.dto;

public class JsonReplicaConfig {
    public long sessionId;
    public String clockMode = "LOGICAL";
    public String format = "BINARY";
    public int dedupeWindow = 1024;
}
