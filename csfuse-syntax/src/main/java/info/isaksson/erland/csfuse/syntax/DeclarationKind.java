package info.isaksson.erland.csfuse.syntax;

public enum DeclarationKind {
    CLASS,
    STRUCT,
    INTERFACE,
    ENUM,
    RECORD,
    DELEGATE,
    /** Top-level statement or anything else that is not a type declaration. */
    STATEMENT;

    static DeclarationKind fromKeyword(String keyword) {
        switch (keyword) {
            case "class":
                return CLASS;
            case "struct":
                return STRUCT;
            case "interface":
                return INTERFACE;
            case "enum":
                return ENUM;
            case "record":
                return RECORD;
            case "delegate":
                return DELEGATE;
            default:
                return null;
        }
    }

    public boolean isType() {
        return this != STATEMENT;
    }
}
