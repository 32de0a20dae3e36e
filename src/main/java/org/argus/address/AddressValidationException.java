package org.argus.address;

/**
 * A malformed address or CIDR block, or a block too large to expand. Fatal to the call that was
 * given the value.
 */
public class AddressValidationException extends IllegalArgumentException {
    private final String value;
    private final long limit;

    public AddressValidationException(String message, String value) {
        this(message, value, -1);
    }

    public AddressValidationException(String message, String value, long limit) {
        super(message);
        this.value = value;
        this.limit = limit;
    }

    public String value() {
        return value;
    }

    /**
     * @return the host limit that was exceeded, or -1 when the failure is not a size violation
     */
    public long limit() {
        return limit;
    }
}
