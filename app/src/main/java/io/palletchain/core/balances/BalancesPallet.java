package io.palletchain.core.balances;

import io.palletchain.core.support.Arithmetic;
import io.palletchain.core.support.Config;
import io.palletchain.core.support.Dispatch;
import io.palletchain.core.support.DispatchResult;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Canonical account -> balance ledger with a flat transfer fee.
 * - unseen accounts hold zero
 * - the fee is credited to the fee recipient when one is set, burned otherwise
 */
public final class BalancesPallet<A extends Comparable<A>, Bal> implements Dispatch<A, BalancesCall<A, Bal>> {

    private final Arithmetic<Bal> math;
    private final Map<A, Bal> balances = new TreeMap<>();
    private Bal baseFee;
    private A feeRecipient; // null = burn

    public BalancesPallet(Config<A, ?, ?, Bal> config) {
        this(config, config.balances().zero(), null);
    }

    public BalancesPallet(Config<A, ?, ?, Bal> config, Bal baseFee, A feeRecipient) {
        this.math = config.balances();
        this.baseFee = baseFee == null ? math.zero() : baseFee;
        this.feeRecipient = feeRecipient;
    }

    public Bal balance(A who) {
        Bal v = balances.get(who);
        return v == null ? math.zero() : v;
    }

    /** Unconditional overwrite (genesis / issuance), not a transfer. */
    public void setBalance(A who, Bal amount) {
        if (who == null) throw new IllegalArgumentException("account required");
        if (amount == null) throw new IllegalArgumentException("amount required");
        balances.put(who, amount);
    }

    public void setTransactionFee(Bal fee) {
        if (fee == null) throw new IllegalArgumentException("fee required");
        this.baseFee = fee;
    }

    public Bal getTransactionFee() {
        return baseFee;
    }

    public void setFeeRecipient(Optional<A> recipient) {
        this.feeRecipient = recipient == null ? null : recipient.orElse(null);
    }

    public Optional<A> getFeeRecipient() {
        return Optional.ofNullable(feeRecipient);
    }

    /**
     * Fee for moving {@code amount}. Flat: the amount does not change it.
     */
    public Bal calculateFee(Bal amount) {
        return baseFee;
    }

    public Bal getTransferCost(Bal amount) throws BalancesException {
        Bal fee = calculateFee(amount);
        return math.checkedAdd(amount, fee)
                .orElseThrow(() -> new BalancesException(BalancesError.OVERFLOW_IN_CALCULATION));
    }

    /**
     * Move {@code amount} from sender to receiver and charge the fee to the sender.
     * Every check runs before the first write, so a failure leaves the ledger untouched.
     */
    public void transfer(A sender, A receiver, Bal amount) throws BalancesException {
        if (sender == null || receiver == null) throw new IllegalArgumentException("sender and receiver required");
        if (amount == null) throw new BalancesException(BalancesError.INVALID_AMOUNT);

        Bal fee = calculateFee(amount);
        Bal totalNeeded = math.checkedAdd(amount, fee)
                .orElseThrow(() -> new BalancesException(BalancesError.OVERFLOW_IN_CALCULATION));

        Bal senderBalance = balance(sender);
        if (math.lessThan(senderBalance, totalNeeded)) {
            throw new BalancesException(BalancesError.INSUFFICIENT_BALANCE);
        }

        // work on a scratch copy of the touched entries; commit at the end
        Map<A, Bal> pending = new TreeMap<>();
        Bal newSender = math.checkedSub(senderBalance, amount)
                .orElseThrow(() -> new BalancesException(BalancesError.INSUFFICIENT_FUNDS));
        pending.put(sender, newSender);

        Bal receiverBalance = pending.containsKey(receiver) ? pending.get(receiver) : balance(receiver);
        Bal newReceiver = math.checkedAdd(receiverBalance, amount)
                .orElseThrow(() -> new BalancesException(BalancesError.OVERFLOW_IN_TRANSFER));
        pending.put(receiver, newReceiver);

        chargeFee(pending, sender, fee);

        balances.putAll(pending);
    }

    private void chargeFee(Map<A, Bal> pending, A payer, Bal fee) throws BalancesException {
        Bal payerBalance = pending.get(payer);
        Bal afterFee = math.checkedSub(payerBalance, fee)
                .orElseThrow(() -> new BalancesException(BalancesError.INSUFFICIENT_FUNDS));
        pending.put(payer, afterFee);

        if (feeRecipient != null) {
            Bal recipientBalance = pending.containsKey(feeRecipient) ? pending.get(feeRecipient) : balance(feeRecipient);
            Bal credited = math.checkedAdd(recipientBalance, fee)
                    .orElseThrow(() -> new BalancesException(BalancesError.OVERFLOW_IN_CALCULATION));
            pending.put(feeRecipient, credited);
        }
    }

    /** Credit without a counterpart (stake release, reward payout). */
    public void deposit(A who, Bal amount) throws BalancesException {
        Bal next = math.checkedAdd(balance(who), amount)
                .orElseThrow(() -> new BalancesException(BalancesError.OVERFLOW_IN_TRANSFER));
        balances.put(who, next);
    }

    /** Debit without a counterpart (stake lock). */
    public void withdraw(A who, Bal amount) throws BalancesException {
        Bal next = math.checkedSub(balance(who), amount)
                .orElseThrow(() -> new BalancesException(BalancesError.INSUFFICIENT_BALANCE));
        balances.put(who, next);
    }

    /** Sum over all accounts. Unbounded so it cannot overflow the balance type. */
    public BigInteger totalIssuance() {
        BigInteger total = BigInteger.ZERO;
        for (Bal v : balances.values()) {
            total = total.add(math.toBigInteger(v));
        }
        return total;
    }

    public Map<A, Bal> accounts() {
        return Collections.unmodifiableMap(balances);
    }

    @Override
    public DispatchResult dispatch(A caller, BalancesCall<A, Bal> call) {
        try {
            if (call instanceof BalancesCall.Transfer<A, Bal> transfer) {
                transfer(caller, transfer.to(), transfer.amount());
                return DispatchResult.ok();
            }
        } catch (BalancesException e) {
            return e.toResult();
        }
        throw new IllegalArgumentException("Unsupported balances call: " + call);
    }
}
