package org.prw.processing.identity;

/**
 * Hash used to mint candidate pseudonymous ids. Implementations must be pure: equal input,
 * equal output.
 */
@FunctionalInterface
public interface IdHashFunction {

    /**
     * @param input hash input, already salted by the caller where needed
     * @return decimal rendering of the hash
     */
    String hash(String input);
}
