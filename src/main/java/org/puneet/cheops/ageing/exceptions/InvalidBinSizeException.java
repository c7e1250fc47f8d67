package org.puneet.cheops.ageing.exceptions;

import java.io.Serial;
import java.util.List;

/**
 * Raised when a time bin width is zero, negative or not a finite number.
 *
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class InvalidBinSizeException extends ValidationException {

    @Serial
    private static final long serialVersionUID = 1L;

    private final double binSizeHours;

    public InvalidBinSizeException(double binSizeHours) {
        super(ValidationType.BIN_SIZE_VALIDATION,
                String.format("Bin width must be a positive number of hours, got %s", binSizeHours),
                List.of(new ValidationError("binSizeHours", binSizeHours, 0.0, ">")),
                null);
        this.binSizeHours = binSizeHours;
    }

    public double getBinSizeHours() {
        return binSizeHours;
    }
}
