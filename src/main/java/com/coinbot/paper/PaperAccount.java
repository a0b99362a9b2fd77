package com.coinbot.paper;

import com.coinbot.model.AccountState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Paper Trading Account
 * Not thread-safe on its own; {@link PaperExchangeClient} guards every access.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PaperAccount {

    private double availableBalance;
    private double usedMargin;

    @Builder.Default
    private double realisedPnl = 0.0;
    @Builder.Default
    private double totalFees = 0.0;

    // Trading statistics
    @Builder.Default
    private int totalTrades = 0;
    @Builder.Default
    private int winningTrades = 0;
    @Builder.Default
    private int losingTrades = 0;

    private Instant lastUpdated;

    public static PaperAccount createNew(double initialBalance) {
        return PaperAccount.builder()
                .availableBalance(initialBalance)
                .usedMargin(0.0)
                .lastUpdated(Instant.now())
                .build();
    }

    public boolean hasSufficientBalance(double requiredAmount) {
        return availableBalance >= requiredAmount;
    }

    /**
     * Moves {@code amount} from the available balance into used margin.
     */
    public void blockMargin(double amount) {
        this.availableBalance -= amount;
        this.usedMargin += amount;
        this.lastUpdated = Instant.now();
    }

    /**
     * Returns {@code margin} to the available balance together with the realised P&L of the trade.
     */
    public void settle(double margin, double pnl) {
        this.usedMargin -= margin;
        this.availableBalance += margin + pnl;
        this.realisedPnl += pnl;
        this.totalTrades++;
        if (pnl > 0) {
            this.winningTrades++;
        } else if (pnl < 0) {
            this.losingTrades++;
        }
        this.lastUpdated = Instant.now();
    }

    public void chargeFee(double fee) {
        this.availableBalance -= fee;
        this.totalFees += fee;
        this.realisedPnl -= fee;
        this.lastUpdated = Instant.now();
    }

    public AccountState toAccountState() {
        return AccountState.builder()
                .availableBalance(availableBalance)
                .usedMargin(usedMargin)
                .totalBalance(availableBalance + usedMargin)
                .realisedPnl(realisedPnl)
                .build();
    }
}
