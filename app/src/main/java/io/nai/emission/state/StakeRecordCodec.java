package io.nai.emission.state;

import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;

import java.nio.ByteBuffer;

/**
 * Fixed-layout binary encoding of stake records (big-endian).
 *
 * validator:  nodeId(20) owner(33) reward(33) start(8) end(8) amount(8) feeRate(4)
 * delegation: delegator(33) nodeId(20) startBlock(8) amount(8) reward(33)
 */
public final class StakeRecordCodec {
    public static final int VALIDATOR_SIZE = NodeId.LENGTH + 2 * Address.LENGTH + 3 * 8 + 4;
    public static final int DELEGATION_SIZE = Address.LENGTH + NodeId.LENGTH + 2 * 8 + Address.LENGTH;

    private StakeRecordCodec() {}

    public static byte[] encode(ValidatorStakeRecord r) {
        ByteBuffer buf = ByteBuffer.allocate(VALIDATOR_SIZE);
        buf.put(r.nodeId().bytes());
        buf.put(r.owner().bytes());
        buf.put(r.rewardAddress().bytes());
        buf.putLong(r.stakeStartTime());
        buf.putLong(r.stakeEndTime());
        buf.putLong(r.stakedAmount());
        buf.putInt(r.delegationFeeRate());
        return buf.array();
    }

    public static ValidatorStakeRecord decodeValidator(byte[] bytes) {
        if (bytes == null || bytes.length != VALIDATOR_SIZE) {
            throw new IllegalArgumentException("Bad validator stake record length");
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        NodeId nodeId = new NodeId(take(buf, NodeId.LENGTH));
        Address owner = new Address(take(buf, Address.LENGTH));
        Address reward = new Address(take(buf, Address.LENGTH));
        long start = buf.getLong();
        long end = buf.getLong();
        long amount = buf.getLong();
        int feeRate = buf.getInt();
        return new ValidatorStakeRecord(nodeId, owner, reward, start, end, amount, feeRate);
    }

    public static byte[] encode(DelegatorStakeRecord r) {
        ByteBuffer buf = ByteBuffer.allocate(DELEGATION_SIZE);
        buf.put(r.delegator().bytes());
        buf.put(r.nodeId().bytes());
        buf.putLong(r.stakeStartBlock());
        buf.putLong(r.stakedAmount());
        buf.put(r.rewardAddress().bytes());
        return buf.array();
    }

    public static DelegatorStakeRecord decodeDelegation(byte[] bytes) {
        if (bytes == null || bytes.length != DELEGATION_SIZE) {
            throw new IllegalArgumentException("Bad delegation record length");
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        Address delegator = new Address(take(buf, Address.LENGTH));
        NodeId nodeId = new NodeId(take(buf, NodeId.LENGTH));
        long startBlock = buf.getLong();
        long amount = buf.getLong();
        Address reward = new Address(take(buf, Address.LENGTH));
        return new DelegatorStakeRecord(delegator, nodeId, startBlock, amount, reward);
    }

    /** Delegation key: nodeId(20) || delegator(33), so a validator's delegations share a prefix. */
    public static byte[] delegationKey(NodeId nodeId, Address delegator) {
        ByteBuffer buf = ByteBuffer.allocate(NodeId.LENGTH + Address.LENGTH);
        buf.put(nodeId.bytes());
        buf.put(delegator.bytes());
        return buf.array();
    }

    private static byte[] take(ByteBuffer buf, int n) {
        byte[] out = new byte[n];
        buf.get(out);
        return out;
    }
}
