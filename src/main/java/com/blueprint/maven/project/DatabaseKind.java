package com.blueprint.maven.project;

/**
 * Supported databases, in the order of the {@code databases} message list.
 */
public enum DatabaseKind {
    HSQL("jdbc:hsqldb:hsql:", "org.hsqldb.jdbc.JDBCDriver",
            "\"org.hsqldb:hsqldb:2.2.9\"", "hsql", "sa", ""),
    POSTGRES("jdbc:postgresql:", "org.postgresql.Driver",
            "\"org.postgresql:postgresql:9.4.1212\"", "postgres", "cuba", "cuba"),
    MSSQL("jdbc:sqlserver:", "com.microsoft.sqlserver.jdbc.SQLServerDriver",
            "\"com.microsoft.sqlserver:mssql-jdbc:6.4.0.jre8\"", "mssql", "sa", "saPass1"),
    MSSQL_JTDS("jdbc:jtds:sqlserver:", "net.sourceforge.jtds.jdbc.Driver",
            "\"net.sourceforge.jtds:jtds:1.3.1\"", "mssql", "sa", "saPass1"),
    MSSQL_2005("jdbc:sqlserver:", "com.microsoft.sqlserver.jdbc.SQLServerDriver",
            "\"com.microsoft.sqlserver:mssql-jdbc:6.4.0.jre8\"", "mssql", "sa", "saPass1"),
    // Oracle users are named after the project
    ORACLE("jdbc:oracle:thin:@", "oracle.jdbc.OracleDriver",
            "files(\"$cuba.tomcat.dir/lib/ojdbc6.jar\")", "oracle", null, "cuba"),
    MYSQL("jdbc:mysql:", "com.mysql.jdbc.Driver",
            "\"mysql:mysql-connector-java:5.1.38\"", "mysql", "cuba", "cuba");

    private final String schema;
    private final String driver;
    private final String driverDependency;
    private final String driverDependencyName;
    private final String username;
    private final String password;

    DatabaseKind(String schema, String driver, String driverDependency, String driverDependencyName,
            String username, String password) {
        this.schema = schema;
        this.driver = driver;
        this.driverDependency = driverDependency;
        this.driverDependencyName = driverDependencyName;
        this.username = username;
        this.password = password;
    }

    public String getSchema() {
        return schema;
    }

    public String getDriver() {
        return driver;
    }

    public String getDriverDependency() {
        return driverDependency;
    }

    public String getDriverDependencyName() {
        return driverDependencyName;
    }

    /**
     * @return the default user, or null when it depends on the project
     */
    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }
}
