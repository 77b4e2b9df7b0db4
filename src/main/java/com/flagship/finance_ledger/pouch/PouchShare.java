package com.flagship.finance_ledger.pouch;

import lombok.Value;

@Value
public class PouchShare {
    String id;
    String pouchId;
    String userId;
    ShareRole role;
}
