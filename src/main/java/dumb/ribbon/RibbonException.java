package dumb.ribbon;

/**
 * Base of every error raised by the ribbon. All of them are programming or
 * configuration errors, so they stay unchecked.
 */
public class RibbonException extends RuntimeException {

    public RibbonException(String message) {
        super(message);
    }

    public RibbonException(String message, Throwable cause) {
        super(message, cause);
    }

    /** A requested span does not fit the allocator's rows, or is not positive. */
    public static class InvalidSpanException extends RibbonException {
        public InvalidSpanException(String message) {
            super(message);
        }
    }

    /** Row capacity, panel titles or the configuration file are invalid. */
    public static class ConfigurationException extends RibbonException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** Lookup by title, index, object or kind name found nothing. */
    public static class NotFoundException extends RibbonException {
        public NotFoundException(String message) {
            super(message);
        }
    }
}
