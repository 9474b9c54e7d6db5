package com.calai.goals.macro.service;

import com.calai.goals.common.InvariantViolationException;
import com.calai.goals.macro.common.DietTemplate;
import com.calai.goals.macro.common.Macro;
import com.calai.goals.macro.common.MacroSplit;
import com.calai.goals.macro.common.MacroTargets;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MacroAllocatorTest {

    private final MacroAllocator allocator = new MacroAllocator();

    @Test
    void balanced_split_at_2210_kcal() {
        MacroTargets t = allocator.allocate(2210, new MacroSplit(40, 30, 30));

        assertThat(t.carbsG()).isEqualTo(221);
        assertThat(t.proteinG()).isEqualTo(166);
        assertThat(t.fatG()).isEqualTo(74);
        assertThat(t.fiberG()).isEqualTo(31);
        assertThat(t.splitBalanced()).isTrue();
    }

    @Test
    void unbalanced_split_is_flagged_not_fixed() {
        MacroTargets t = allocator.allocate(2000, new MacroSplit(50, 30, 30));

        assertThat(t.splitBalanced()).isFalse();
        assertThat(t.carbsG()).isEqualTo(250);

        assertThatThrownBy(() -> allocator.allocateStrict(2000, new MacroSplit(50, 30, 30)))
                .isInstanceOf(InvariantViolationException.class)
                .hasMessageContaining("110");
    }

    @Test
    void grams_use_4_4_9() {
        assertThat(MacroAllocator.grams(1800, 100, Macro.FAT)).isEqualTo(200);
        assertThat(MacroAllocator.grams(1800, 100, Macro.PROTEIN)).isEqualTo(450);
        assertThat(MacroAllocator.fiberGrams(0)).isZero();
    }

    @Test
    void templates_resolve_to_fixed_splits() {
        assertThat(DietTemplate.BALANCED.resolve(null)).isEqualTo(new MacroSplit(40, 30, 30));
        assertThat(DietTemplate.HIGH_PROTEIN.resolve(new MacroSplit(1, 1, 98))).isEqualTo(new MacroSplit(45, 30, 25));
        assertThat(DietTemplate.CUSTOM.resolve(new MacroSplit(20, 40, 40))).isEqualTo(new MacroSplit(20, 40, 40));
        assertThat(DietTemplate.CUSTOM.resolve(null)).isEqualTo(new MacroSplit(40, 30, 30));

        assertThat(DietTemplate.parseOrDefault("healthy-eating")).isEqualTo(DietTemplate.HEALTHY_EATING);
        assertThat(DietTemplate.parseOrDefault("keto")).isEqualTo(DietTemplate.BALANCED);

        for (DietTemplate t : DietTemplate.values()) {
            assertThat(t.resolve(null).isBalanced()).as(t.name()).isTrue();
        }
    }
}
