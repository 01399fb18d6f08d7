package org.prw.common.exception;

public class IdentityCollisionException extends RuntimeException {

	private static final long serialVersionUID = -6340188521704526214L;

	private final int batchPosition;
	private final int attempts;

	/**
	 * Thrown when a new pseudonymous id keeps colliding after the configured number of
	 * rehashes. Hitting this with a 32-bit hash means the mapping is close to saturated or
	 * the hash function has been replaced by something degenerate; either way the batch must
	 * not be committed.
	 *
	 * @param batchPosition position of the offending row within the batch
	 * @param attempts number of perturbations tried before giving up
	 */
	public IdentityCollisionException(int batchPosition, int attempts) {
		super("Unable to mint a unique pseudonymous id for batch row " + batchPosition
				+ " after " + attempts + " rehash attempts. "
				+ "No identity mappings from this batch have been persisted.");
		this.batchPosition = batchPosition;
		this.attempts = attempts;
	}

	public int getBatchPosition() {
		return batchPosition;
	}

	public int getAttempts() {
		return attempts;
	}
}
