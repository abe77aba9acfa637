package org.strata.options;

/**
 * Configuration keys and defaults shared by the loader and the CLI.
 */
public final class StrataOptions {

    private StrataOptions() {
    }

    public static final class Profile {
        private Profile() {}

        public static final String DEFAULT = "dev";

        /** Environment variable selecting the profile when none is given on the command line. */
        public static final String ENV_VAR = "STRATA_PROFILE";

        public static final String CONFIG_FILE = "strata.yaml";
    }

    public static final class Naming {
        private Naming() {}

        /**
         * Maximum length of generated constraint and index names. The default is the
         * PostgreSQL identifier limit, the lowest of the supported databases.
         */
        public static final String MAX_LENGTH_KEY = "strata.naming.maxLength";
        public static final int MAX_LENGTH_DEFAULT = 63;
    }

    public static final class Database {
        private Database() {}

        public static final String DIALECT_KEY = "strata.database.dialect";
        public static final String URL_KEY = "strata.database.url";
        public static final String USERNAME_KEY = "strata.database.username";
        public static final String PASSWORD_KEY = "strata.database.password";
    }

    public static final class Schema {
        private Schema() {}

        public static final String DIRECTORY_KEY = "strata.schema.directory";
        public static final String DIRECTORY_DEFAULT = "schema";
    }

    public static final class Output {
        private Output() {}

        public static final String DIRECTORY_KEY = "strata.output.directory";
        public static final String DIRECTORY_DEFAULT = "build/strata";
    }
}
