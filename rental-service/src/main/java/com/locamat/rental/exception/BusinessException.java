package com.locamat.rental.exception;

/**
 * Caller input violates a precondition. Raised before any row lock is taken.
 */
public class BusinessException extends RentalException {

    public BusinessException(String message) {
        super(message);
    }
}
