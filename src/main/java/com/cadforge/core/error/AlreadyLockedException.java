package com.cadforge.core.error;

import com.cadforge.core.model.ResourceLock;

import java.util.Map;

/**
 * The resource is leased by another holder whose lease has not expired.
 */
public class AlreadyLockedException extends CadforgeException {

    private final ResourceLock heldLock;

    public AlreadyLockedException(ResourceLock heldLock) {
        super(ErrorKind.ALREADY_LOCKED,
                "Resource " + heldLock.resourceType() + "/" + heldLock.resourceName()
                        + " is locked by '" + heldLock.holderId() + "'",
                Map.of("resource_type", heldLock.resourceType(),
                        "resource_name", heldLock.resourceName(),
                        "holder_id", heldLock.holderId(),
                        "expires_at", heldLock.expiresAt().toString()));
        this.heldLock = heldLock;
    }

    public ResourceLock heldLock() {
        return heldLock;
    }
}
