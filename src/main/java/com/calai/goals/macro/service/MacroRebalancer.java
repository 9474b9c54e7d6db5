package com.calai.goals.macro.service;

import com.calai.goals.macro.common.Macro;
import com.calai.goals.macro.common.MacroSplit;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 使用者拖動其中一個滑桿後，重新分配另外兩個，讓三者永遠加總 100。
 *
 * 規則：remaining = 100 - v，按兩者「目前彼此的比例」分；
 * 第一個（宣告順序）用 round(remaining * ratio)，第二個一律拿 remaining - 第一個，
 * 所以不管 round 幾次，加總都剛好 100。兩者都是 0 時各分一半。
 */
@Component
public class MacroRebalancer {

    public MacroSplit rebalance(MacroSplit current, Macro moved, int newValue) {
        return rebalance(current, moved, newValue, Set.of());
    }

    /**
     * @param locked 鎖住的滑桿不會被動到；被拖的那個本身鎖住時原樣回傳
     */
    public MacroSplit rebalance(MacroSplit current, Macro moved, int newValue, Set<Macro> locked) {
        Set<Macro> locks = (locked == null) ? Set.of() : locked;
        if (locks.contains(moved)) return current;

        int v = clamp(newValue, 0, 100);

        List<Macro> free = new ArrayList<>(2);
        Macro lockedPeer = null;
        for (Macro m : Macro.values()) {
            if (m == moved) continue;
            if (locks.contains(m)) lockedPeer = m;
            else free.add(m);
        }

        // 兩個都鎖住：沒有空間可以調
        if (free.isEmpty()) return current;

        if (free.size() == 1) {
            // 鎖住的值也夾回 0..100，另外兩個才不會變負
            int lockedValue = clamp(current.get(lockedPeer), 0, 100);
            v = Math.min(v, 100 - lockedValue);
            return current
                    .with(lockedPeer, lockedValue)
                    .with(moved, v)
                    .with(free.get(0), 100 - v - lockedValue);
        }

        int remaining = 100 - v;
        Macro first = free.get(0);
        Macro second = free.get(1);
        int a = Math.max(0, current.get(first));
        int b = Math.max(0, current.get(second));
        double ratio = (a + b == 0) ? 0.5 : (double) a / (a + b);

        int firstValue = (int) Math.round(remaining * ratio);
        int secondValue = remaining - firstValue;

        return current
                .with(moved, v)
                .with(first, firstValue)
                .with(second, secondValue);
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
