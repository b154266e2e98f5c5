package com.mobifone.updatecenter.service;

import com.mobifone.updatecenter.entity.BatchItem;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Attributes the installer's overall percentage to individual items, assuming the
 * installer works through them one by one in install order.
 * <p>
 * With {@code n} installing items and overall percent {@code p}, the item at
 * {@code floor(p / 100 * n)} is the current one; everything before it is considered done
 * and the current item gets the share of {@code p} that falls in its slot. Pure function:
 * the caller applies the plan.
 */
public final class ItemProgressEstimator {

    private ItemProgressEstimator() {
    }

    @Value
    public static class Plan {
        List<String> completedItemIds;
        String currentItemId;       // null when every installing item is estimated done
        int currentItemPercent;
    }

    public static Plan estimate(List<BatchItem> installing, int overallPercent) {
        List<BatchItem> ordered = new ArrayList<>(installing);
        ordered.sort(BatchItem.INSTALL_ORDER);

        int n = ordered.size();
        if (n == 0) {
            return new Plan(List.of(), null, 0);
        }

        double p = Math.max(0, Math.min(100, overallPercent));
        int itemIndex = (int) Math.floor(p / 100.0 * n);

        List<String> done = new ArrayList<>();
        for (int i = 0; i < Math.min(itemIndex, n); i++) {
            done.add(ordered.get(i).getId());
        }
        if (itemIndex >= n) {
            return new Plan(done, null, 0);
        }

        double slot = 100.0 / n;
        long share = Math.round(((p - itemIndex * slot) / slot) * 100);
        int percent = (int) Math.max(0, Math.min(100, share));
        return new Plan(done, ordered.get(itemIndex).getId(), percent);
    }
}
