/**
 * Thrown when an input of a trace run cannot be used:
 * - a file is missing or not a regular file
 * - the monitored tag column is absent
 * - a workbook or L5X document cannot be read at all
 */
public class L5XInputException extends Exception {

    public L5XInputException(String message) {
        super(message);
    }

    public L5XInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
