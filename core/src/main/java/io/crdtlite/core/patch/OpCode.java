// file: src/main/java/io/crdtlite/core/patch/OpCode.java
package io.crdtlite.core.patch;

/** Operation kinds with their stable numeric codes and textual names. */
public enum OpCode {
    NEW_CON(0, "new_con"),
    NEW_VAL(1, "new_val"),
    NEW_OBJ(2, "new_obj"),
    NEW_VEC(3, "new_vec"),
    NEW_STR(4, "new_str"),
    NEW_BIN(5, "new_bin"),
    NEW_ARR(6, "new_arr"),
    INS_VAL(9, "ins_val"),
    INS_OBJ(10, "ins_obj"),
    INS_VEC(11, "ins_vec"),
    INS_STR(12, "ins_str"),
    INS_BIN(13, "ins_bin"),
    INS_ARR(14, "ins_arr"),
    UPD_ARR(15, "upd_arr"),
    DEL(16, "del"),
    NOP(17, "nop");

    private static final OpCode[] BY_CODE = new OpCode[32];

    static {
        for (var c : values()) BY_CODE[c.code] = c;
    }

    private final int code;
    private final String opName;

    OpCode(int code, String opName) {
        this.code = code;
        this.opName = opName;
    }

    public int code() {
        return code;
    }

    public String opName() {
        return opName;
    }

    /** Kind for a numeric code, or null when the code is not assigned. */
    public static OpCode fromCode(int code) {
        return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
    }

    /** Kind for a textual name, or null when unknown. */
    public static OpCode fromName(String name) {
        for (var c : values()) if (c.opName.equals(name)) return c;
        return null;
    }
}
