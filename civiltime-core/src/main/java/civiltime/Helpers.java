package civiltime;

import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;

public final class Helpers {

    private Helpers() {
    }

    /**
     * It tries to extract a meaningful message for any exception
     * @param t
     * @return
     */
    public static String resolveThrowableException(Throwable t) {
        StringBuilder builder = new StringBuilder();
        while (t.getCause() != null) {
            String message = t.getMessage();
            if (message == null) {
                message = t.getClass().getSimpleName();
            }
            builder.append(message).append(": ");
            t = t.getCause();
        }
        String message = t.getMessage();
        // Helping resolve bad exception's message
        if (t instanceof NoSuchFileException) {
            message = "No such file " + t.getMessage();
        } else if (t instanceof AccessDeniedException) {
            message = "Access denied to file " + t.getMessage();
        } else if (t instanceof ArrayIndexOutOfBoundsException) {
            message = "Array out of bounds: " + message;
        } else if (t instanceof InterruptedException) {
            builder.setLength(0);
            message = "Interrupted";
        } else if (message == null) {
            message = t.getClass().getSimpleName();
        }
        builder.append(message);
        return builder.toString();
    }

}
