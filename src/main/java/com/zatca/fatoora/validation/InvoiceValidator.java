package com.zatca.fatoora.validation;

import com.zatca.fatoora.model.ChainPosition;
import com.zatca.fatoora.model.InvoiceDocument;
import com.zatca.fatoora.model.InvoiceLineItem;
import com.zatca.fatoora.model.InvoiceRequest;
import com.zatca.fatoora.model.Party;
import com.zatca.fatoora.tlv.TlvCodec;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Local business-rule checks run before an invoice is sequenced.
 *
 * <p>Catches what the platform would reject anyway, without consuming an
 * ICV. Chain fields are only checked when the invoice already carries a
 * chain position.
 */
public class InvoiceValidator {

    public static final String CATEGORY_INVOICE = "INVOICE";
    public static final String CATEGORY_SELLER = "SELLER";
    public static final String CATEGORY_BUYER = "BUYER";
    public static final String CATEGORY_LINE = "LINE";
    public static final String CATEGORY_CHAIN = "CHAIN";
    public static final String CATEGORY_REFERENCE = "REFERENCE";

    /** 15 digits, first and last digit 3 */
    private static final Pattern VAT_NUMBER = Pattern.compile("^3\\d{13}3$");
    private static final Pattern POSTAL_CODE = Pattern.compile("^\\d{5}$");
    private static final Set<BigDecimal> ALLOWED_VAT_RATES = Set.of(
        BigDecimal.ZERO, BigDecimal.valueOf(5), BigDecimal.valueOf(15));

    public InvoiceValidationResult validate(InvoiceDocument invoice) {
        List<ValidationMessage> errors = new ArrayList<>();
        List<ValidationMessage> warnings = new ArrayList<>();

        if (isBlank(invoice.getId())) {
            errors.add(new ValidationMessage("INV-001", CATEGORY_INVOICE, "id", "Invoice number is required"));
        }
        if (isBlank(invoice.getUuid())) {
            errors.add(new ValidationMessage("INV-002", CATEGORY_INVOICE, "uuid", "Invoice UUID is required"));
        }
        if (invoice.getIssueDateTime() == null) {
            errors.add(new ValidationMessage("INV-003", CATEGORY_INVOICE, "issueDateTime", "Issue date is required"));
        }

        validateSeller(invoice.getSeller(), errors);
        validateLines(invoice.getLineItems(), errors);

        ChainPosition position = invoice.getChainPosition();
        if (position != null) {
            if (position.getInvoiceCounterValue() < 1) {
                errors.add(new ValidationMessage("CHN-001", CATEGORY_CHAIN, "chainPosition.invoiceCounterValue",
                    "Invoice counter value must be positive"));
            }
            if (isBlank(position.getPreviousInvoiceHash())) {
                errors.add(new ValidationMessage("CHN-002", CATEGORY_CHAIN, "chainPosition.previousInvoiceHash",
                    "Previous invoice hash is required"));
            }
        }

        if (invoice instanceof InvoiceRequest) {
            Party buyer = ((InvoiceRequest) invoice).getBuyer();
            if (buyer == null || isBlank(buyer.getName())) {
                warnings.add(new ValidationMessage("BUY-001", CATEGORY_BUYER, "buyer.name",
                    "Buyer name is recommended on standard invoices"));
            }
        }

        if (invoice.getTypeCode().isAmendment() && invoice.getBillingReference() == null) {
            warnings.add(new ValidationMessage("REF-001", CATEGORY_REFERENCE, "billingReference",
                invoice.getTypeCode().getDisplayName() + " should reference the original invoice"));
        }

        return new InvoiceValidationResult(errors, warnings);
    }

    private void validateSeller(Party seller, List<ValidationMessage> errors) {
        if (seller == null || isBlank(seller.getName())) {
            errors.add(new ValidationMessage("SEL-001", CATEGORY_SELLER, "seller.name", "Seller name is required"));
        } else if (seller.getName().getBytes(StandardCharsets.UTF_8).length > TlvCodec.MAX_VALUE_LENGTH) {
            // The name is QR tag 1; it must fit a one-byte TLV length
            errors.add(new ValidationMessage("SEL-003", CATEGORY_SELLER, "seller.name",
                "Seller name must not exceed " + TlvCodec.MAX_VALUE_LENGTH + " bytes in UTF-8"));
        }
        String vatNumber = seller != null ? seller.getVatNumber() : null;
        if (vatNumber == null || !VAT_NUMBER.matcher(vatNumber).matches()) {
            errors.add(new ValidationMessage("SEL-002", CATEGORY_SELLER, "seller.vatNumber",
                "Seller VAT number must be 15 digits starting and ending with 3"));
        }
        if (seller != null && seller.getPostalCode() != null
                && !POSTAL_CODE.matcher(seller.getPostalCode()).matches()) {
            errors.add(new ValidationMessage("SEL-005", CATEGORY_SELLER, "seller.postalCode",
                "Seller postal code must be 5 digits"));
        }
    }

    private void validateLines(List<InvoiceLineItem> items, List<ValidationMessage> errors) {
        if (items == null || items.isEmpty()) {
            errors.add(new ValidationMessage("LIN-001", CATEGORY_LINE, "lineItems", "At least one line item is required"));
            return;
        }

        for (int i = 0; i < items.size(); i++) {
            InvoiceLineItem item = items.get(i);
            String prefix = "lineItems[" + i + "].";
            if (isBlank(item.getName())) {
                errors.add(new ValidationMessage("LIN-002", CATEGORY_LINE, prefix + "name", "Item name is required"));
            }
            if (item.getQuantity().signum() <= 0) {
                errors.add(new ValidationMessage("LIN-003", CATEGORY_LINE, prefix + "quantity",
                    "Quantity must be positive"));
            }
            if (item.getUnitPrice().signum() < 0) {
                errors.add(new ValidationMessage("LIN-004", CATEGORY_LINE, prefix + "unitPrice",
                    "Unit price must not be negative"));
            }
            if (!isAllowedRate(item.getVatRate())) {
                errors.add(new ValidationMessage("LIN-006", CATEGORY_LINE, prefix + "vatRate",
                    "VAT rate must be 0, 5 or 15 percent, got " + item.getVatRate().toPlainString()));
            }
        }
    }

    private boolean isAllowedRate(BigDecimal rate) {
        return ALLOWED_VAT_RATES.stream().anyMatch(allowed -> allowed.compareTo(rate) == 0);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
