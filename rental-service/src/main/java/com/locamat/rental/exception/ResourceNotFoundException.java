package com.locamat.rental.exception;

import java.util.Collection;
import java.util.List;

public class ResourceNotFoundException extends RentalException {

    private final String resource;
    private final List<Long> missingIds;

    public ResourceNotFoundException(String resource, Collection<Long> missingIds) {
        super(resource + " not found: " + List.copyOf(missingIds));
        this.resource = resource;
        this.missingIds = List.copyOf(missingIds);
    }

    public ResourceNotFoundException(String resource, Long missingId) {
        this(resource, List.of(missingId));
    }

    public String getResource() {
        return resource;
    }

    public List<Long> getMissingIds() {
        return missingIds;
    }
}
