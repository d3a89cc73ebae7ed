package com.zatca.fatoora.xml;

import com.ctc.wstx.stax.WstxOutputFactory;
import com.zatca.fatoora.exception.FatooraException;
import com.zatca.fatoora.exception.ValidationException;
import com.zatca.fatoora.model.ChainPosition;
import com.zatca.fatoora.model.InvoiceDocument;
import com.zatca.fatoora.model.InvoiceLineItem;
import com.zatca.fatoora.model.InvoiceRequest;
import com.zatca.fatoora.model.InvoiceTotals;
import com.zatca.fatoora.model.Party;
import com.zatca.fatoora.model.SimplifiedInvoiceData;
import com.zatca.fatoora.model.VatCategory;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamWriter2;

import javax.xml.stream.XMLStreamException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders UBL 2.1 invoice XML for standard and simplified invoices.
 *
 * <p>Output depends only on the input: no clock, no randomness, no I/O.
 * The rendered text is what gets hashed into the chain, so the same
 * invoice always yields the same bytes. Documents are written through a
 * Woodstox {@link XMLStreamWriter2} whose text escaper is {@link XmlEscaper};
 * amounts always carry two decimals.
 *
 * <p>Example usage:
 * <pre>{@code
 * InvoiceXmlBuilder builder = new InvoiceXmlBuilder();
 * String xml = builder.buildSimplifiedInvoiceXml(data.withChainPosition(position));
 * }</pre>
 */
public class InvoiceXmlBuilder {

    public static final String UBL_INVOICE_NAMESPACE = "urn:oasis:names:specification:ubl:schema:xsd:Invoice-2";
    public static final String UBL_CAC_NAMESPACE =
        "urn:oasis:names:specification:ubl:schema:xsd:CommonAggregateComponents-2";
    public static final String UBL_CBC_NAMESPACE =
        "urn:oasis:names:specification:ubl:schema:xsd:CommonBasicComponents-2";

    private static final String PROFILE_ID = "reporting:1.0";
    private static final DateTimeFormatter ISSUE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter ISSUE_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private static final XMLOutputFactory2 OUTPUT_FACTORY = createOutputFactory();

    private static XMLOutputFactory2 createOutputFactory() {
        XMLOutputFactory2 factory = new WstxOutputFactory();
        factory.setProperty(XMLOutputFactory2.IS_REPAIRING_NAMESPACES, Boolean.FALSE);
        factory.setProperty(XMLOutputFactory2.P_TEXT_ESCAPER, new XmlEscaper.TextEscaperFactory());
        return factory;
    }

    /**
     * Render a standard (B2B) invoice including the buyer party.
     *
     * @throws ValidationException if the invoice has no chain position
     */
    public String buildInvoiceXml(InvoiceRequest request) {
        return render(request, request.getBuyer());
    }

    /**
     * Render a simplified (B2C) invoice.
     *
     * @throws ValidationException if the invoice has no chain position
     */
    public String buildSimplifiedInvoiceXml(SimplifiedInvoiceData data) {
        return render(data, null);
    }

    /**
     * Render either kind of invoice.
     *
     * @throws FatooraException with code {@code XML_RENDER_ERROR} if the writer fails
     */
    public String build(InvoiceDocument document) {
        if (document instanceof InvoiceRequest) {
            return buildInvoiceXml((InvoiceRequest) document);
        }
        if (document instanceof SimplifiedInvoiceData) {
            return buildSimplifiedInvoiceXml((SimplifiedInvoiceData) document);
        }
        throw new IllegalArgumentException("Unsupported invoice type: " + document.getClass().getName());
    }

    /**
     * Format an amount with exactly two decimals, rounding half up.
     */
    public static String formatAmount(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    public static String formatAmount(double amount) {
        return formatAmount(BigDecimal.valueOf(amount));
    }

    private String render(InvoiceDocument invoice, Party buyer) {
        ChainPosition position = invoice.getChainPosition();
        if (position == null) {
            throw new ValidationException("Invoice must be sequenced before it is rendered",
                "CHAIN_POSITION_MISSING", "chainPosition");
        }

        StringWriter target = new StringWriter(4096);
        try {
            UblWriter xml = new UblWriter((XMLStreamWriter2) OUTPUT_FACTORY.createXMLStreamWriter(target));
            writeInvoice(xml, invoice, position, buyer);
            xml.finish();
        } catch (XMLStreamException e) {
            throw new FatooraException("Failed to render invoice XML", "XML_RENDER_ERROR", e);
        }
        return target.toString();
    }

    private void writeInvoice(UblWriter xml, InvoiceDocument invoice, ChainPosition position, Party buyer)
            throws XMLStreamException {
        String currency = invoice.getCurrency();
        InvoiceTotals totals = invoice.getTotals();

        xml.startInvoice();
        xml.leaf("ProfileID", PROFILE_ID);
        xml.leaf("ID", invoice.getId());
        xml.leaf("UUID", invoice.getUuid());
        if (invoice.getIssueDateTime() != null) {
            xml.leaf("IssueDate", invoice.getIssueDateTime().format(ISSUE_DATE));
            xml.leaf("IssueTime", invoice.getIssueDateTime().format(ISSUE_TIME));
        }
        xml.leaf("InvoiceTypeCode", "name", invoice.getTypeCode().getDisplayName(),
            invoice.getTypeCode().getCode());
        xml.leaf("DocumentCurrencyCode", currency);
        xml.leaf("TaxCurrencyCode", currency);

        if (invoice.getBillingReference() != null) {
            xml.open("BillingReference");
            xml.open("InvoiceDocumentReference");
            xml.leaf("ID", invoice.getBillingReference().getInvoiceNumber());
            xml.close();
            xml.close();
        }

        xml.open("AdditionalDocumentReference");
        xml.leaf("ID", "ICV");
        xml.leaf("UUID", String.valueOf(position.getInvoiceCounterValue()));
        xml.close();
        xml.open("AdditionalDocumentReference");
        xml.leaf("ID", "PIH");
        xml.open("Attachment");
        xml.leaf("EmbeddedDocumentBinaryObject", "mimeCode", "text/plain", position.getPreviousInvoiceHash());
        xml.close();
        xml.close();

        writeParty(xml, "AccountingSupplierParty", invoice.getSeller());
        if (buyer != null) {
            writeParty(xml, "AccountingCustomerParty", buyer);
        }

        writeTaxTotal(xml, invoice.getLineItems(), totals, currency);

        xml.open("LegalMonetaryTotal");
        xml.amount("LineExtensionAmount", totals.getLineExtensionAmount(), currency);
        xml.amount("TaxExclusiveAmount", totals.getTaxExclusiveAmount(), currency);
        xml.amount("TaxInclusiveAmount", totals.getTaxInclusiveAmount(), currency);
        xml.amount("PayableAmount", totals.getPayableAmount(), currency);
        xml.close();

        List<InvoiceLineItem> items = invoice.getLineItems();
        for (int i = 0; i < items.size(); i++) {
            writeLine(xml, i + 1, items.get(i), currency);
        }
    }

    private void writeParty(UblWriter xml, String role, Party party) throws XMLStreamException {
        if (party == null) {
            return;
        }
        xml.open(role);
        xml.open("Party");
        if (party.getVatNumber() != null) {
            xml.open("PartyIdentification");
            xml.leaf("ID", "schemeID", "VAT", party.getVatNumber());
            xml.close();
        }
        if (party.hasAddress()) {
            xml.open("PostalAddress");
            xml.optionalLeaf("StreetName", party.getStreet());
            xml.optionalLeaf("BuildingNumber", party.getBuildingNumber());
            xml.optionalLeaf("CitySubdivisionName", party.getDistrict());
            xml.optionalLeaf("CityName", party.getCity());
            xml.optionalLeaf("PostalZone", party.getPostalCode());
            xml.open("Country");
            xml.leaf("IdentificationCode", party.getCountryCode());
            xml.close();
            xml.close();
        }
        if (party.getVatNumber() != null) {
            xml.open("PartyTaxScheme");
            xml.leaf("CompanyID", party.getVatNumber());
            xml.open("TaxScheme");
            xml.leaf("ID", "VAT");
            xml.close();
            xml.close();
        }
        xml.open("PartyLegalEntity");
        xml.leaf("RegistrationName", party.getName());
        xml.close();
        xml.close();
        xml.close();
    }

    private void writeTaxTotal(UblWriter xml, List<InvoiceLineItem> items, InvoiceTotals totals, String currency)
            throws XMLStreamException {
        // One subtotal per distinct rate, in first-seen order
        Map<String, BigDecimal[]> subtotals = new LinkedHashMap<>();
        Map<String, InvoiceLineItem> representative = new LinkedHashMap<>();
        for (InvoiceLineItem item : items) {
            String key = item.getVatRate().stripTrailingZeros().toPlainString();
            BigDecimal[] sums = subtotals.computeIfAbsent(key, k -> new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
            sums[0] = sums[0].add(item.getLineExtensionAmount());
            sums[1] = sums[1].add(item.getTaxAmount());
            representative.putIfAbsent(key, item);
        }

        xml.open("TaxTotal");
        xml.amount("TaxAmount", totals.getTaxAmount(), currency);
        for (Map.Entry<String, BigDecimal[]> entry : subtotals.entrySet()) {
            InvoiceLineItem item = representative.get(entry.getKey());
            xml.open("TaxSubtotal");
            xml.amount("TaxableAmount", entry.getValue()[0], currency);
            xml.amount("TaxAmount", entry.getValue()[1], currency);
            writeTaxCategory(xml, "TaxCategory", item.getVatCategory(), item.getVatRate());
            xml.close();
        }
        xml.close();
    }

    private void writeLine(UblWriter xml, int lineNumber, InvoiceLineItem item, String currency)
            throws XMLStreamException {
        xml.open("InvoiceLine");
        xml.leaf("ID", String.valueOf(lineNumber));
        xml.leaf("InvoicedQuantity", "unitCode", "PCE", item.getQuantity().stripTrailingZeros().toPlainString());
        xml.amount("LineExtensionAmount", item.getLineExtensionAmount(), currency);
        xml.open("TaxTotal");
        xml.amount("TaxAmount", item.getTaxAmount(), currency);
        xml.amount("RoundingAmount", item.getAmountInclusive(), currency);
        xml.close();
        xml.open("Item");
        xml.leaf("Name", item.getName());
        writeTaxCategory(xml, "ClassifiedTaxCategory", item.getVatCategory(), item.getVatRate());
        xml.close();
        xml.open("Price");
        xml.amount("PriceAmount", item.getUnitPrice(), currency);
        xml.close();
        xml.close();
    }

    private void writeTaxCategory(UblWriter xml, String element, VatCategory category, BigDecimal rate)
            throws XMLStreamException {
        xml.open(element);
        xml.leaf("ID", category.getCode());
        xml.leaf("Percent", formatAmount(rate));
        xml.open("TaxScheme");
        xml.leaf("ID", "VAT");
        xml.close();
        xml.close();
    }

    /**
     * Indenting facade over the stream writer. {@link #open} names aggregate
     * ({@code cac}) elements, {@link #leaf} names basic ({@code cbc}) ones.
     */
    private static final class UblWriter {
        private static final String INDENT = "    ";

        private final XMLStreamWriter2 writer;
        private int depth;

        UblWriter(XMLStreamWriter2 writer) {
            this.writer = writer;
        }

        void startInvoice() throws XMLStreamException {
            writer.writeStartDocument("UTF-8", "1.0");
            writer.writeSpace("\n");
            writer.writeStartElement("", "Invoice", UBL_INVOICE_NAMESPACE);
            writer.writeDefaultNamespace(UBL_INVOICE_NAMESPACE);
            writer.writeNamespace("cac", UBL_CAC_NAMESPACE);
            writer.writeNamespace("cbc", UBL_CBC_NAMESPACE);
            depth = 1;
        }

        void open(String localName) throws XMLStreamException {
            indent();
            writer.writeStartElement("cac", localName, UBL_CAC_NAMESPACE);
            depth++;
        }

        void close() throws XMLStreamException {
            depth--;
            indent();
            writer.writeEndElement();
        }

        void leaf(String localName, String text) throws XMLStreamException {
            indent();
            writer.writeStartElement("cbc", localName, UBL_CBC_NAMESPACE);
            writer.writeCharacters(text == null ? "" : text);
            writer.writeEndElement();
        }

        void leaf(String localName, String attribute, String attributeValue, String text)
                throws XMLStreamException {
            indent();
            writer.writeStartElement("cbc", localName, UBL_CBC_NAMESPACE);
            writer.writeAttribute(attribute, attributeValue == null ? "" : attributeValue);
            writer.writeCharacters(text == null ? "" : text);
            writer.writeEndElement();
        }

        void optionalLeaf(String localName, String text) throws XMLStreamException {
            if (text != null && !text.isEmpty()) {
                leaf(localName, text);
            }
        }

        void amount(String localName, BigDecimal value, String currency) throws XMLStreamException {
            leaf(localName, "currencyID", currency, formatAmount(value));
        }

        void finish() throws XMLStreamException {
            depth = 0;
            indent();
            writer.writeEndElement();
            writer.writeSpace("\n");
            writer.writeEndDocument();
            writer.close();
        }

        private void indent() throws XMLStreamException {
            StringBuilder space = new StringBuilder(1 + depth * INDENT.length()).append('\n');
            for (int i = 0; i < depth; i++) {
                space.append(INDENT);
            }
            writer.writeSpace(space.toString());
        }
    }
}
