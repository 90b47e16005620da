package io.nai.emission.consensus;

import io.nai.emission.protocol.NodeId;

import java.util.Map;

/** Current consensus membership (node id -> public key), independent of staking. */
@FunctionalInterface
public interface ValidatorSetSource {
    Map<NodeId, byte[]> currentValidators();
}
