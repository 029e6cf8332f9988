package com.kiisha.ai.gateway.policy;

import java.util.Optional;

/**
 * Mutating actions that must be confirmed by a human before they are committed.
 */
public enum HighImpactAction {
    EXTERNAL_SHARE("external_share", "This will share data with external parties."),
    EXPORT_DATA("export_data", "This will export data outside the platform."),
    MARK_VERIFIED("mark_verified", "This will mark the data as verified."),
    CHANGE_ACCESS("change_access", "This will change access permissions."),
    TEMPLATE_ROLLOUT("template_rollout", "This will roll out template changes to all users."),
    VATR_UPDATE("vatr_update", "This will update the VATR record."),
    REQUEST_SUBMIT("request_submit", "This will submit the request."),
    CROSS_ORG_SHARE("cross_org_share", "This will share data across organizations."),
    BULK_DELETE("bulk_delete", "This will permanently delete multiple items."),
    FINANCIAL_FIELD_CHANGE("financial_field_change", "This will modify financial data.");

    public static final String GENERIC_CONFIRMATION_MESSAGE = "This action requires confirmation.";

    private final String code;
    private final String confirmationMessage;

    HighImpactAction(String code, String confirmationMessage) {
        this.code = code;
        this.confirmationMessage = confirmationMessage;
    }

    public String getCode() {
        return code;
    }

    public String getConfirmationMessage() {
        return confirmationMessage;
    }

    public static Optional<HighImpactAction> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (HighImpactAction action : values()) {
            if (action.code.equals(code)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    /**
     * User-facing explanation for an action type; generic text for anything outside the catalogue.
     */
    public static String messageFor(String actionType) {
        return fromCode(actionType)
                .map(HighImpactAction::getConfirmationMessage)
                .orElse(GENERIC_CONFIRMATION_MESSAGE);
    }
}
