package com.hindsight.execution.account;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Currency;
import java.util.Objects;

/**
 * Simulated cash account denominated in a single currency.
 */
public class Account {

    private static final Logger log = LoggerFactory.getLogger(Account.class);

    private final String accountId;
    private final Currency currency;
    private final double startingBalance;
    private double cashBalance;

    public Account(String accountId, Currency currency, double startingBalance) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.currency = Objects.requireNonNull(currency, "currency");
        this.startingBalance = startingBalance;
        this.cashBalance = startingBalance;
    }

    public void credit(double amount) {
        cashBalance += amount;
    }

    public void debit(double amount) {
        cashBalance -= amount;
    }

    /**
     * Restore the starting balance.
     */
    public void reset() {
        cashBalance = startingBalance;
        log.debug("Account {} reset to {} {}", accountId, startingBalance, currency);
    }

    public String getAccountId() { return accountId; }
    public Currency getCurrency() { return currency; }
    public double getStartingBalance() { return startingBalance; }
    public double getCashBalance() { return cashBalance; }
}
