package com.zatca.fatoora.model;

import java.util.Objects;

/**
 * Seller or buyer on an invoice
 */
public final class Party {

    private final String name;
    private final String vatNumber;
    private final String street;
    private final String buildingNumber;
    private final String district;
    private final String city;
    private final String postalCode;
    private final String countryCode;

    private Party(Builder builder) {
        this.name = builder.name;
        this.vatNumber = builder.vatNumber;
        this.street = builder.street;
        this.buildingNumber = builder.buildingNumber;
        this.district = builder.district;
        this.city = builder.city;
        this.postalCode = builder.postalCode;
        this.countryCode = builder.countryCode;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() { return name; }
    public String getVatNumber() { return vatNumber; }
    public String getStreet() { return street; }
    public String getBuildingNumber() { return buildingNumber; }
    public String getDistrict() { return district; }
    public String getCity() { return city; }
    public String getPostalCode() { return postalCode; }
    public String getCountryCode() { return countryCode; }

    public boolean hasAddress() {
        return street != null || city != null || postalCode != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Party party = (Party) o;
        return Objects.equals(name, party.name)
            && Objects.equals(vatNumber, party.vatNumber)
            && Objects.equals(street, party.street)
            && Objects.equals(buildingNumber, party.buildingNumber)
            && Objects.equals(district, party.district)
            && Objects.equals(city, party.city)
            && Objects.equals(postalCode, party.postalCode)
            && Objects.equals(countryCode, party.countryCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, vatNumber, street, buildingNumber, district, city, postalCode, countryCode);
    }

    public static class Builder {
        private String name;
        private String vatNumber;
        private String street;
        private String buildingNumber;
        private String district;
        private String city;
        private String postalCode;
        private String countryCode = "SA";

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder vatNumber(String vatNumber) {
            this.vatNumber = vatNumber;
            return this;
        }

        public Builder street(String street) {
            this.street = street;
            return this;
        }

        public Builder buildingNumber(String buildingNumber) {
            this.buildingNumber = buildingNumber;
            return this;
        }

        public Builder district(String district) {
            this.district = district;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder postalCode(String postalCode) {
            this.postalCode = postalCode;
            return this;
        }

        public Builder countryCode(String countryCode) {
            this.countryCode = countryCode;
            return this;
        }

        public Party build() {
            return new Party(this);
        }
    }
}
