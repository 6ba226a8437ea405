package de.bsommerfeld.labreport.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Locale;

/**
 * Running mode of the server. {@code PROD} persists documents to SQLite,
 * {@code TEST} keeps them in memory for demos and integration runs.
 *
 * <p>
 * Resolution order: the {@code --test} command line flag, the
 * {@code app.mode} system property, the {@code APP_MODE} environment
 * variable. Anything unset or unrecognized means {@code PROD}.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    public static final String TEST_FLAG = "--test";

    public static ApplicationMode get() {
        return resolve(System.getProperty("app.mode"), System.getenv("APP_MODE"));
    }

    public static ApplicationMode fromArgs(String[] args) {
        if (args != null && Arrays.asList(args).contains(TEST_FLAG)) {
            return TEST;
        }
        return get();
    }

    /**
     * @param property value of {@code app.mode}, may be {@code null}
     * @param env      value of {@code APP_MODE}, consulted only when the
     *                 property is unset or empty
     */
    static ApplicationMode resolve(String property, String env) {
        String mode = (property == null || property.isEmpty()) ? env : property;
        if (mode == null || mode.isBlank()) {
            return PROD;
        }
        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown Application Mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
