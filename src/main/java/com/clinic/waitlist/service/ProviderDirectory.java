package com.clinic.waitlist.service;

/**
 * Read-only view of the clinic's providers, used to validate provider keys.
 */
public interface ProviderDirectory {

    boolean exists(String providerKey);
}
