package org.rtlgraph.frontend.xml;

/**
 * Thrown when a syntax-tree document cannot be read at all.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>The file does not exist or is unreadable</li>
 *   <li>The document is not well-formed XML</li>
 *   <li>The document has no {@code module} element</li>
 * </ul>
 * <p>
 * Unknown tags inside an otherwise readable document are not an error; they are read as
 * unrecognized nodes.
 */
public class AstReadException extends RuntimeException {

    /**
     * Creates an AstReadException with the specified message.
     *
     * @param message Description of the failure
     */
    public AstReadException(String message) {
        super(message);
    }

    /**
     * Creates an AstReadException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public AstReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
