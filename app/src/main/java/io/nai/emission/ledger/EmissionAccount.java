package io.nai.emission.ledger;

import io.nai.emission.protocol.Address;

import java.util.Objects;

/** Protocol fee sink: credited by fee distribution, drained by its owner. */
public final class EmissionAccount {
    private final Address address;
    private long unclaimedBalance;

    public EmissionAccount(Address address, long unclaimedBalance) {
        this.address = Objects.requireNonNull(address, "address");
        if (unclaimedBalance < 0) {
            throw new IllegalArgumentException("unclaimedBalance must be >= 0");
        }
        this.unclaimedBalance = unclaimedBalance;
    }

    public Address address() { return address; }
    public long unclaimedBalance() { return unclaimedBalance; }

    void credit(long amount) {
        unclaimedBalance = Math.addExact(unclaimedBalance, amount);
    }

    long drain() {
        long balance = unclaimedBalance;
        unclaimedBalance = 0L;
        return balance;
    }

    EmissionAccount copy() {
        return new EmissionAccount(address, unclaimedBalance);
    }

    @Override
    public String toString() {
        return "EmissionAccount{" + address + ", unclaimed=" + unclaimedBalance + '}';
    }
}
