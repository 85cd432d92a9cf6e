package br.edu.ifba.agentflow.components;

import br.edu.ifba.agentflow.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Connection settings of the SQL stage. Validated even though no query is ever executed.
 */
public class ExeSqlParam extends GenerateParam {

    static final List<String> DB_TYPES = List.of("mysql", "postgresql", "mariadb", "mssql");

    static final String RESERVED_DATABASE = "rag_flow";

    @JsonProperty("db_type")
    private String dbType = "mysql";

    private String database = "";

    private String username = "";

    private String host = "";

    private int port = 3306;

    private String password = "";

    private int loop = 3;

    @JsonProperty("top_n")
    private int topN = 30;

    @Override
    protected String label() {
        return "[ExeSQL]";
    }

    @Override
    public void check() {
        super.check();
        checkValidValue(dbType, "[ExeSQL] DB type", DB_TYPES);
        checkEmpty(database, "[ExeSQL] Database name");
        checkEmpty(username, "[ExeSQL] Database username");
        checkEmpty(host, "[ExeSQL] IP Address");
        checkPositiveInteger(port, "[ExeSQL] IP Port");
        checkEmpty(password, "[ExeSQL] Database password");
        checkPositiveInteger(topN, "[ExeSQL] Number of records");
        if (RESERVED_DATABASE.equals(database)
            && ("ragflow-mysql".equals(host) || "infini_rag_flow".equals(password))) {
            throw new ConfigurationException(
                "For the security reason, it does not support database named " + RESERVED_DATABASE + ".");
        }
    }

    @NotNull
    public String getDbType() {
        return dbType != null ? dbType : "";
    }

    @NotNull
    public String getDatabase() {
        return database != null ? database : "";
    }

    @NotNull
    public String getHost() {
        return host != null ? host : "";
    }

    public int getPort() {
        return port;
    }

    public int getLoop() {
        return loop;
    }

    public int getTopN() {
        return topN;
    }
}
