package com.zatca.fatoora.crypto;

import com.zatca.fatoora.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Subject data for a Compliance CSID certificate signing request.
 * Every field is mandatory except {@code organizationUnitName}.
 */
public final class CsrConfig {

    private final String commonName;
    private final String serialNumber;
    private final String organizationName;
    private final String organizationUnitName;
    private final String countryName;
    private final String invoiceType;
    private final String location;
    private final String industry;

    private CsrConfig(Builder builder) {
        this.commonName = builder.commonName;
        this.serialNumber = builder.serialNumber;
        this.organizationName = builder.organizationName;
        this.organizationUnitName = builder.organizationUnitName;
        this.countryName = builder.countryName;
        this.invoiceType = builder.invoiceType;
        this.location = builder.location;
        this.industry = builder.industry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getCommonName() { return commonName; }
    public String getSerialNumber() { return serialNumber; }
    public String getOrganizationName() { return organizationName; }
    public String getOrganizationUnitName() { return organizationUnitName; }
    public String getCountryName() { return countryName; }
    public String getInvoiceType() { return invoiceType; }
    public String getLocation() { return location; }
    public String getIndustry() { return industry; }

    public boolean hasOrganizationUnitName() {
        return organizationUnitName != null && !organizationUnitName.isBlank();
    }

    /**
     * @throws ValidationException naming the first missing mandatory field
     */
    public void validate() {
        Map<String, String> mandatory = new LinkedHashMap<>();
        mandatory.put("commonName", commonName);
        mandatory.put("serialNumber", serialNumber);
        mandatory.put("organizationName", organizationName);
        mandatory.put("countryName", countryName);
        mandatory.put("invoiceType", invoiceType);
        mandatory.put("location", location);
        mandatory.put("industry", industry);

        for (Map.Entry<String, String> entry : mandatory.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                throw new ValidationException(
                    "CSR field '" + entry.getKey() + "' is required", "CSR_FIELD_MISSING", entry.getKey());
            }
        }
        if (countryName.length() != 2) {
            throw new ValidationException(
                "CSR countryName must be a two-letter ISO code", "CSR_FIELD_INVALID", "countryName");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CsrConfig that = (CsrConfig) o;
        return Objects.equals(commonName, that.commonName)
            && Objects.equals(serialNumber, that.serialNumber)
            && Objects.equals(organizationName, that.organizationName)
            && Objects.equals(organizationUnitName, that.organizationUnitName)
            && Objects.equals(countryName, that.countryName)
            && Objects.equals(invoiceType, that.invoiceType)
            && Objects.equals(location, that.location)
            && Objects.equals(industry, that.industry);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonName, serialNumber, organizationName, organizationUnitName,
            countryName, invoiceType, location, industry);
    }

    public static class Builder {
        private String commonName;
        private String serialNumber;
        private String organizationName;
        private String organizationUnitName;
        private String countryName;
        private String invoiceType;
        private String location;
        private String industry;

        public Builder commonName(String commonName) {
            this.commonName = commonName;
            return this;
        }

        /**
         * Solution serial in the regulator's {@code 1-name|2-model|3-serial} form
         */
        public Builder serialNumber(String serialNumber) {
            this.serialNumber = serialNumber;
            return this;
        }

        public Builder organizationName(String organizationName) {
            this.organizationName = organizationName;
            return this;
        }

        public Builder organizationUnitName(String organizationUnitName) {
            this.organizationUnitName = organizationUnitName;
            return this;
        }

        public Builder countryName(String countryName) {
            this.countryName = countryName;
            return this;
        }

        /**
         * Four-digit invoice type flags, e.g. {@code 1100} for standard and simplified
         */
        public Builder invoiceType(String invoiceType) {
            this.invoiceType = invoiceType;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder industry(String industry) {
            this.industry = industry;
            return this;
        }

        public CsrConfig build() {
            return new CsrConfig(this);
        }
    }
}
