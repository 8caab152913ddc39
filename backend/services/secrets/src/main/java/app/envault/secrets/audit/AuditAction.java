package app.envault.secrets.audit;

public enum AuditAction {
    ORGANIZATION_CREATE("organization.create"),
    ORGANIZATION_KEK_ROTATE("organization.kek_rotate"),
    SECRET_CREATE("secret.create"),
    SECRET_READ("secret.read"),
    SECRET_UPDATE("secret.update"),
    SECRET_LIST_WITH_VALUES("secret.list_with_values"),
    SECRET_DELETE("secret.delete"),
    SECRET_DELETE_PERMANENT("secret.delete_permanent"),
    SECRET_ROLLBACK("secret.rollback"),
    SECRET_BULK_UPSERT("secret.bulk_upsert"),
    SECRET_EXPORT("secret.export");

    private final String code;

    AuditAction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
