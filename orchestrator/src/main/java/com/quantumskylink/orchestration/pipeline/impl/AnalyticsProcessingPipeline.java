package com.quantumskylink.orchestration.pipeline.impl;

import com.quantumskylink.orchestration.catalog.WorkflowCatalogConfiguration;
import com.quantumskylink.orchestration.client.MarketplaceClient;
import com.quantumskylink.orchestration.client.dto.AnalyticsQuery;
import com.quantumskylink.orchestration.client.dto.AnalyticsStageResult;
import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import com.quantumskylink.orchestration.pipeline.PipelineStep;
import com.quantumskylink.orchestration.pipeline.RequestBinder;
import com.quantumskylink.orchestration.pipeline.StepResult;
import com.quantumskylink.orchestration.pipeline.WorkflowPipeline;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * marketplace-analytics-processing.
 *
 * <pre>
 *   Collect Listing Analytics → Collect Order Analytics → Calculate Trends
 *     → Aggregate Analytics → Generate Report → Record Report
 * </pre>
 *
 * Read-only aggregation, so there is no signature gate. Each stage receives
 * the previous stages' data as its payload.
 */
@Component
public class AnalyticsProcessingPipeline implements WorkflowPipeline {

    static final String INPUT = "analyticsRequest";

    private final RequestBinder     binder;
    private final MarketplaceClient marketplace;

    public AnalyticsProcessingPipeline(RequestBinder binder, MarketplaceClient marketplace) {
        this.binder      = binder;
        this.marketplace = marketplace;
    }

    @Override
    public String workflowId() {
        return WorkflowCatalogConfiguration.ANALYTICS;
    }

    @Override
    public List<PipelineStep> plan(WorkflowExecutionContext context) {
        AnalyticsRequest request = binder.bind(context.getInputs(), INPUT, AnalyticsRequest.class);
        String requestId = request.requestId() != null ? request.requestId() : context.getExecutionId();

        Run run = new Run(request, new AnalyticsQuery(requestId, request.analyticsType(), request.timeRange(),
                request.includeTokens(), request.includeFees(), request.includePricing(), null));
        return List.of(
                PipelineStep.fatal("Collect Listing Analytics", run::collectListings),
                PipelineStep.fatal("Collect Order Analytics",   run::collectOrders),
                PipelineStep.fatal("Calculate Trends",          run::calculateTrends),
                PipelineStep.fatal("Aggregate Analytics",       run::aggregate),
                PipelineStep.fatal("Generate Report",           run::generateReport),
                PipelineStep.fatal("Record Report",             run::record));
    }

    @Override
    public List<String> validateRequest(Map<String, Object> inputs) {
        return binder.check(inputs, INPUT, AnalyticsRequest.class, request -> List.of());
    }

    private final class Run {

        private final AnalyticsRequest request;
        private final AnalyticsQuery   query;
        private AnalyticsStageResult listings;
        private AnalyticsStageResult orders;
        private AnalyticsStageResult trends;
        private AnalyticsStageResult aggregation;
        private AnalyticsStageResult report;

        Run(AnalyticsRequest request, AnalyticsQuery query) {
            this.request = request;
            this.query   = query;
        }

        StepResult collectListings(WorkflowExecutionContext ctx) {
            listings = marketplace.listingAnalytics(query);
            return check(listings, "Listing analytics");
        }

        StepResult collectOrders(WorkflowExecutionContext ctx) {
            orders = marketplace.orderAnalytics(query);
            return check(orders, "Order analytics");
        }

        StepResult calculateTrends(WorkflowExecutionContext ctx) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("listingData", listings.data());
            payload.put("orderData", orders.data());
            trends = marketplace.calculateTrends(query.withPayload(payload));
            return check(trends, "Trend calculation");
        }

        StepResult aggregate(WorkflowExecutionContext ctx) {
            aggregation = marketplace.aggregate(query.withPayload(Map.of("trendData", trends.data())));
            return check(aggregation, "Aggregation");
        }

        StepResult generateReport(WorkflowExecutionContext ctx) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("aggregatedData", aggregation.data());
            payload.put("userId", request.userId());
            report = marketplace.generateReport(query.withPayload(payload));
            return check(report, "Report generation");
        }

        StepResult record(WorkflowExecutionContext ctx) {
            Map<String, Object> results = new LinkedHashMap<>();
            results.put("reportId", report.reportId());
            results.put("totalDataPoints", aggregation.dataPoints());
            results.put("requestId", query.requestId());
            results.put("analyticsType", query.analyticsType());
            return StepResult.ok(results);
        }

        private StepResult check(AnalyticsStageResult stage, String label) {
            return stage.success()
                    ? StepResult.ok()
                    : StepResult.rejected(label + " failed: " + stage.message());
        }
    }
}
