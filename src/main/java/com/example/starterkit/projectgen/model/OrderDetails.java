package com.example.starterkit.projectgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Order a project is generated for, as supplied by the order/license provider
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderDetails {
    private String id;

    /**
     * Human-facing order number (printed in LICENSE.md and README.md)
     */
    private String orderNumber;

    /**
     * Pricing tier, e.g. "starter", "pro", "enterprise"
     */
    private String tier;

    /**
     * Feature slugs picked by the customer in the configurator
     */
    @Builder.Default
    private List<String> selectedFeatures = new ArrayList<>();

    private String customerEmail;

    /**
     * Optional; the license falls back to the email when absent
     */
    private String customerName;

    private BigDecimal total;

    /**
     * Template bundle the order started from, if any
     */
    private TemplateRef template;

    /**
     * License issued for the order, if already created
     */
    private LicenseRef license;

    public List<String> templateFeatures() {
        if (template == null || template.getIncludedFeatures() == null) {
            return List.of();
        }
        return template.getIncludedFeatures();
    }
}
