package org.dgov.constants;

public final class FileNames {

    public static final String NODE_PROPERTIES = "node.properties";
    public static final String GOVERNANCE_DB = "governance.db";

    private FileNames() {
    }
}
