package com.yerin.submitflow.domain;

import jakarta.persistence.*;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "business_profiles")
public class BusinessProfile {

    @Id
    @Column(name = "customer_id", length = 64)
    private String customerId;

    @Column(name = "business_name", nullable = false)
    private String businessName;

    private String email;
    private String phone;
    private String website;
    private String address;
    private String city;
    private String state;
    private String zip;

    @Column(columnDefinition = "text")
    private String description;

    private String category;

    /**
     * Snapshot of the fields sent to directories. Null values are written as empty strings
     * so the canonical form does not depend on which columns happen to be null.
     */
    public Map<String, String> snapshot() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("business_name", nz(businessName));
        m.put("email", nz(email));
        m.put("phone", nz(phone));
        m.put("website", nz(website));
        m.put("address", nz(address));
        m.put("city", nz(city));
        m.put("state", nz(state));
        m.put("zip", nz(zip));
        m.put("description", nz(description));
        m.put("category", nz(category));
        return m;
    }

    private static String nz(String v) { return v == null ? "" : v; }
}
