package com.kmg.gateway.dto;

import com.kmg.gateway.model.CreditAccount;
import com.kmg.gateway.repo.SqlTime;

import java.util.List;

public record AccountView(
        String callerId,
        long balance,
        String updatedAt,
        List<ApiKeyView> keys
) {
    public static AccountView from(CreditAccount account, List<ApiKeyView> keys) {
        return new AccountView(account.callerId(), account.balance(), SqlTime.text(account.updatedAt()), keys);
    }
}
