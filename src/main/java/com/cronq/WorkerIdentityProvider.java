package com.cronq;

/**
 * Source of the identity stamped onto jobs claimed by this process.
 * <p>
 * CronQ only reads the identity. Making sure two processes never work the same
 * job (leases, fencing tokens) is the responsibility of the implementation
 * that is plugged in here.
 */
@FunctionalInterface
public interface WorkerIdentityProvider {

    WorkerIdentity currentIdentity();
}
