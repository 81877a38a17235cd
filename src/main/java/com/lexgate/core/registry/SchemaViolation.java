package com.lexgate.core.registry;

/**
 * A structural error in one TF document. Fatal to that TF only.
 *
 * @param tfId   the document's id, or its file name when the id itself is missing
 * @param field  dotted path of the offending field
 * @param source file the document was read from
 */
public record SchemaViolation(String tfId, String field, String reason, String source) {

    @Override
    public String toString() {
        return tfId + ": " + field + ": " + reason + " (" + source + ")";
    }
}
