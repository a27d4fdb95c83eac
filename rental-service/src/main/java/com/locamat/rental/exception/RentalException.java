package com.locamat.rental.exception;

/**
 * Base type for the failures the reservation and restitution engine reports to its caller.
 * Thrown from inside a transaction, any subtype rolls the whole unit of work back.
 */
public abstract class RentalException extends RuntimeException {

    protected RentalException(String message) {
        super(message);
    }

    protected RentalException(String message, Throwable cause) {
        super(message, cause);
    }
}
