/**
 * Pause and daily reaction digests.
 *
 * @see chorus.digest.DigestScheduler
 */
package chorus.digest;
