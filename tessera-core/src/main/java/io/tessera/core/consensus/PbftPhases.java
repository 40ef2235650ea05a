package io.tessera.core.consensus;

/// Outcome of the three Byzantine phase checks.
///
/// @param prepare votes with confidence above zero reached quorum
/// @param commit votes with confidence of at least 0.5 reached quorum
/// @param reply PASS votes reached quorum
public record PbftPhases(boolean prepare, boolean commit, boolean reply) {

    /// All phases failed; used for fallback results.
    public static final PbftPhases NONE = new PbftPhases(false, false, false);

    public boolean allSucceeded() {
        return prepare && commit && reply;
    }
}
