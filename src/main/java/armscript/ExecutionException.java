package armscript;

/** Raised when a quadruple list cannot be executed, e.g. a loop without its end. */
public class ExecutionException extends RuntimeException {
    private final int address;

    public ExecutionException(String message, int address) {
        super(message + " (at quadruple " + address + ")");
        this.address = address;
    }

    public int getAddress() { return address; }
}
