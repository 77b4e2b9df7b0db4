package com.flagship.finance_ledger.common;

/**
 * Currency code enum following ISO-4217.
 *
 * Accounts, transactions and transfers carry one of these; a ledger record's
 * currency must match the currency of the account it posts to.
 */
public enum CurrencyCode {
    USD, // US Dollar
    EUR, // Euro
    GBP, // British Pound
    INR, // Indian Rupee
    JPY, // Japanese Yen
    NGN, // Nigerian Naira
    KES  // Kenyan Shilling
}
