package com.quantumskylink.orchestration.catalog;

import com.quantumskylink.orchestration.model.InputType;
import com.quantumskylink.orchestration.model.WorkflowDefinition;
import com.quantumskylink.orchestration.model.WorkflowInput;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Declares the workflow types this build supports.
 *
 * Each id here must have a matching pipeline bean; the executor refuses to
 * start otherwise.
 */
@Configuration
public class WorkflowCatalogConfiguration {

    public static final String NAMESPACE = "quantumskylink";

    public static final String PAYMENT     = "payment-processing-zero-trust";
    public static final String ONBOARDING  = "user-onboarding-optimized";
    public static final String TREASURY    = "treasury-operations-secure";
    public static final String LISTING     = "marketplace-listing-creation";
    public static final String ORDER       = "marketplace-order-processing";
    public static final String ESCROW      = "marketplace-escrow-management";
    public static final String ANALYTICS   = "marketplace-analytics-processing";

    @Bean
    public WorkflowCatalog workflowCatalog() {
        return new WorkflowCatalog(defaultDefinitions());
    }

    /** The built-in definitions; also used directly by unit tests. */
    public static List<WorkflowDefinition> defaultDefinitions() {
        return List.of(
                definition(PAYMENT, "Zero-Trust Payment Processing",
                        "Payment processing with comprehensive signature validation",
                        List.of("payments", "zero-trust"), Duration.ofSeconds(5),
                        WorkflowInput.required("paymentRequest", InputType.OBJECT,
                                "Payment request with signature")),
                definition(ONBOARDING, "Optimized User Onboarding",
                        "User onboarding with multisig provisioning and object storage publication",
                        List.of("users", "multisig"), Duration.ofSeconds(10),
                        WorkflowInput.required("userRegistration", InputType.OBJECT,
                                "User registration data; must contain userId")),
                definition(TREASURY, "Secure Treasury Operations",
                        "High-security treasury operations with multi-signature approval",
                        List.of("treasury"), Duration.ofSeconds(15),
                        WorkflowInput.required("treasuryOperation", InputType.OBJECT,
                                "Treasury operation request")),
                definition(LISTING, "Marketplace Listing Creation",
                        "Create marketplace listings with zero-trust signature validation",
                        List.of("marketplace"), Duration.ofSeconds(3),
                        WorkflowInput.required("listingRequest", InputType.OBJECT,
                                "Listing creation request with signature validation data")),
                definition(ORDER, "Marketplace Order Processing",
                        "Process marketplace orders with listing validation",
                        List.of("marketplace"), Duration.ofSeconds(5),
                        WorkflowInput.required("orderRequest", InputType.OBJECT,
                                "Order processing request with signature validation data")),
                definition(ESCROW, "Marketplace Escrow Management",
                        "Manage marketplace escrow operations with order verification",
                        List.of("marketplace", "escrow"), Duration.ofSeconds(7),
                        WorkflowInput.required("escrowRequest", InputType.OBJECT,
                                "Escrow management request with signature validation data")),
                definition(ANALYTICS, "Marketplace Analytics Processing",
                        "Process marketplace analytics with data collection and trend analysis",
                        List.of("marketplace", "analytics"), Duration.ofSeconds(10),
                        WorkflowInput.required("analyticsRequest", InputType.OBJECT,
                                "Analytics processing request with data collection parameters"))
        );
    }

    private static WorkflowDefinition definition(String id, String name, String description,
                                                 List<String> tags, Duration estimate,
                                                 WorkflowInput... inputs) {
        return new WorkflowDefinition(id, name, description, NAMESPACE, "1.0.0",
                tags, List.of(inputs), estimate, true);
    }
}
