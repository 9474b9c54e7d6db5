package com.calai.goals.plan.controller;

import com.calai.goals.adjustment.common.ConfigOutOfRangeException;
import com.calai.goals.algorithm.AlgorithmCategory;
import com.calai.goals.algorithm.AlgorithmSelection;
import com.calai.goals.algorithm.UnknownAlgorithmException;
import com.calai.goals.common.InvariantViolationException;
import com.calai.goals.common.web.ApiExceptionHandler;
import com.calai.goals.energy.common.BmiClass;
import com.calai.goals.energy.common.EnergyBudget;
import com.calai.goals.macro.common.MacroSplit;
import com.calai.goals.plan.common.GoalField;
import com.calai.goals.plan.common.GoalPatch;
import com.calai.goals.plan.dto.PlanRequest;
import com.calai.goals.plan.dto.PlanResponse;
import com.calai.goals.plan.service.GoalPlanService;
import com.calai.goals.plan.web.GoalsExceptionAdvice;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.ZoneId;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = GoalPlanController.class)
@Import({GoalsExceptionAdvice.class, ApiExceptionHandler.class})
class GoalPlanControllerTest {

    @Autowired MockMvc mvc;

    @MockitoBean GoalPlanService svc;

    private static final String PLAN_BODY = """
            {"gender":"MALE","age":30,"heightCm":180,"weightKg":80,
             "exerciseLevel":"moderate","goal":"LOSE"}
            """;

    private static PlanResponse readyPlan() {
        GoalPatch goals = GoalPatch.builder()
                .put(GoalField.CALORIES, 2210)
                .put(GoalField.SATURATED_FAT, 14.7)
                .build();
        return new PlanResponse(true, List.of(), new EnergyBudget(1780, 2759, 2210),
                24.7, BmiClass.Normal, null, new MacroSplit(40, 30, 30),
                AlgorithmSelection.defaults(), goals, List.of());
    }

    @Test
    void plan_should_200_with_snake_case_goal_keys() throws Exception {
        Mockito.when(svc.plan(any(PlanRequest.class), isNull())).thenReturn(readyPlan());

        mvc.perform(post("/api/v1/goals/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLAN_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ready").value(true))
                .andExpect(jsonPath("$.energy.dailyCalorieGoal").value(2210))
                .andExpect(jsonPath("$.goals.calories").value(2210))
                .andExpect(jsonPath("$.goals.saturated_fat").value(14.7));
    }

    @Test
    void plan_passes_valid_timezone_and_ignores_invalid_one() throws Exception {
        Mockito.when(svc.plan(any(PlanRequest.class), any())).thenReturn(readyPlan());

        mvc.perform(post("/api/v1/goals/plan")
                        .header("X-Client-Timezone", "Asia/Taipei")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLAN_BODY))
                .andExpect(status().isOk());
        Mockito.verify(svc).plan(any(PlanRequest.class), eq(ZoneId.of("Asia/Taipei")));

        mvc.perform(post("/api/v1/goals/plan")
                        .header("X-Client-Timezone", "Mars/Olympus")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLAN_BODY))
                .andExpect(status().isOk());
        Mockito.verify(svc).plan(any(PlanRequest.class), isNull());
    }

    @Test
    void unknown_algorithm_should_400_with_category_and_identifier() throws Exception {
        Mockito.when(svc.plan(any(PlanRequest.class), any()))
                .thenThrow(new UnknownAlgorithmException(AlgorithmCategory.BMR, "Katch-McArdle"));

        mvc.perform(post("/api/v1/goals/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLAN_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNKNOWN_ALGORITHM"))
                .andExpect(jsonPath("$.category").value("BMR"))
                .andExpect(jsonPath("$.identifier").value("Katch-McArdle"));
    }

    @Test
    void invariant_violation_should_422() throws Exception {
        Mockito.when(svc.plan(any(PlanRequest.class), any()))
                .thenThrow(new InvariantViolationException("fat breakdown exceeds total fat"));

        mvc.perform(post("/api/v1/goals/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PLAN_BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVARIANT_VIOLATION"))
                .andExpect(jsonPath("$.message").value("fat breakdown exceeds total fat"));
    }

    @Test
    void config_out_of_range_should_400_with_field() throws Exception {
        Mockito.when(svc.remaining(any()))
                .thenThrow(new ConfigOutOfRangeException("elapsedDayFraction", 1.5, 0, 1));

        mvc.perform(post("/api/v1/goals/remaining")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"goalKcal\":2000,\"eatenKcal\":1500}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CONFIG_OUT_OF_RANGE"))
                .andExpect(jsonPath("$.field").value("elapsedDayFraction"));
    }

    @Test
    void rebalance_missing_field_should_400_with_field_errors() throws Exception {
        mvc.perform(post("/api/v1/goals/macros/rebalance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"protein\":30,\"fat\":30,\"moved\":\"FAT\",\"value\":40}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.fields.carbs").value("Carbs is required"));

        Mockito.verifyNoInteractions(svc);
    }

    @Test
    void rebalance_should_200() throws Exception {
        Mockito.when(svc.rebalance(any())).thenReturn(new MacroSplit(46, 20, 34));

        mvc.perform(post("/api/v1/goals/macros/rebalance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"carbs\":40,\"protein\":30,\"fat\":30,\"moved\":\"FAT\",\"value\":34}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.carbsPct").value(46))
                .andExpect(jsonPath("$.proteinPct").value(20))
                .andExpect(jsonPath("$.fatPct").value(34));
    }

    @Test
    void unreadable_json_should_400() throws Exception {
        mvc.perform(post("/api/v1/goals/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not-json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void negative_age_should_400() throws Exception {
        mvc.perform(post("/api/v1/goals/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gender\":\"MALE\",\"age\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.age").exists());
    }

    @Test
    void rebalance_percent_over_100_should_400() throws Exception {
        mvc.perform(post("/api/v1/goals/macros/rebalance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"carbs\":40,\"protein\":30,\"fat\":120,\"moved\":\"CARBS\",\"value\":40,\"locked\":[\"FAT\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.fields.fat").exists());

        Mockito.verifyNoInteractions(svc);
    }

    @Test
    void plan_weight_over_limit_should_400() throws Exception {
        mvc.perform(post("/api/v1/goals/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"gender\":\"MALE\",\"age\":30,\"heightCm\":180,\"weightKg\":1000000000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.weightKg").value("Weight must be at most 800 kg"));

        Mockito.verifyNoInteractions(svc);
    }
}
