package org.postgresql.pointers.examples.springframework.security;

import org.postgresql.pointers.config.PointerSettings;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URI;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.apache.commons.lang3.StringUtils.isNotBlank;

/**
 * Log DatabaseMetaData (Database + Driver + pointer installation)
 * <p>
 * This class provides a user-friendly description of the database the
 * pointer tables live in, so that it is easily found when skimming through
 * logs. A surprising share of "missing pointer" reports turn out to be a
 * connection to the wrong database, or an installation under other names.
 * <p>
 * This class has been put in the `security` package since the site may wish
 * to mask some or all of the data, with filtering based on the Spring
 * Profile.
 */
public class LogDatabaseMetaData {
    private static final String SEPARATOR0 =
            "+================================================================================================+";
    private static final String SEPARATOR1 =
            "+--------------------+--------------------+------------------------------------------------------+";
    private static final String FORMAT = "| %-18.18s : %-18.18s : %-52.52s |\n";

    private LogDatabaseMetaData() {
    }

    /**
     * Describe the database server and driver, followed by any additional
     * blocks of information.
     *
     * @param dbmd           metadata of an open connection
     * @param additionalInfo block label -> (key -> value)
     * @return multi-line description
     * @throws SQLException if the metadata cannot be read
     */
    public static String format(DatabaseMetaData dbmd, Map<String, Map<String, String>> additionalInfo) throws SQLException {
        final StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw)) {
            pw.println(SEPARATOR0);
            pw.printf(FORMAT, "Database Server", "Name", dbmd.getDatabaseProductName());
            pw.printf(FORMAT, "", "Version", dbmd.getDatabaseProductVersion());
            pw.printf(FORMAT, "", "URL", sanitizeJdbcUrl(dbmd.getURL()));
            pw.println(SEPARATOR1);

            pw.printf(FORMAT, "Driver", "Name", dbmd.getDriverName());
            pw.printf(FORMAT, "", "Version", dbmd.getDriverVersion());
            pw.printf(FORMAT, "", "JDBC Version", dbmd.getJDBCMajorVersion() + "." + dbmd.getJDBCMinorVersion());
            pw.println(SEPARATOR1);

            pw.printf(FORMAT, "Client", "User", dbmd.getUserName());
            pw.printf(FORMAT, "", "OS User", System.getProperty("user.name"));
            pw.printf(FORMAT, "", "OS Name", System.getProperty("os.name"));

            if ((additionalInfo != null) && !additionalInfo.isEmpty()) {
                for (Map.Entry<String, Map<String, String>> block : additionalInfo.entrySet()) {
                    if (!block.getValue().isEmpty()) {
                        pw.println(SEPARATOR1);
                        String label = block.getKey();
                        for (Map.Entry<String, String> entry : block.getValue().entrySet()) {
                            pw.printf(FORMAT, label, entry.getKey(), entry.getValue());
                            label = "";
                        }
                    }
                }
            }
            pw.println(SEPARATOR0);
        }
        return sw.toString();
    }

    public static String format(DatabaseMetaData dbmd) throws SQLException {
        return format(dbmd, Collections.emptyMap());
    }

    /**
     * The names the pointers abstraction is installed under, as a block for
     * {@link #format(DatabaseMetaData, Map)}.
     *
     * @param settings installation names
     * @return single block keyed "Pointers"
     */
    public static Map<String, Map<String, String>> pointers(PointerSettings settings) {
        final Map<String, String> names = new LinkedHashMap<>();
        names.put("Registry", settings.tableTable().deparse());
        names.put("Pointers", settings.pointerTable().deparse());
        names.put("Function", settings.triggerFunction().deparse());
        names.put("Trigger Prefix", settings.triggerPrefix().deparse());
        return Collections.singletonMap("Pointers", names);
    }

    /**
     * Sanitize JDBC URL
     * <p>
     * A JDBC URL may have user credentials in the authority or as query
     * parameters. This method keeps only the scheme, host, port and path.
     * The URI class doesn't understand the 'jdbc:' subprotocol prefix, so
     * it is removed first.
     *
     * @param url JDBC URL
     * @return URL without credentials
     */
    public static String sanitizeJdbcUrl(String url) {
        if ((url == null) || !url.startsWith("jdbc:")) {
            return "(undetermined)";
        }

        final URI uri = URI.create(url.substring(5)).normalize();

        final StringBuilder sb = new StringBuilder("jdbc:");
        sb.append(uri.getScheme());
        sb.append("://");

        sb.append(uri.getHost());
        if (uri.getPort() > 0) {
            sb.append(":").append(uri.getPort());
        }

        if (isNotBlank(uri.getPath())) {
            sb.append(uri.getPath());
        }

        return sb.toString();
    }
}
