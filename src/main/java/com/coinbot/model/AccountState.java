package com.coinbot.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AccountState {
    double availableBalance;
    double usedMargin;
    double totalBalance;
    double realisedPnl;
}
