package xrl.core.model;

public enum Decision {
    GRANT,
    DENY
}
