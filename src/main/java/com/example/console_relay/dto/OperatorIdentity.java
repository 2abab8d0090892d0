package com.example.console_relay.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OperatorIdentity {

    public static final String ADMIN_ROLE = "admin";

    private Long id;
    private String email;
    private String role;

    public boolean isAdmin() {
        return ADMIN_ROLE.equals(role);
    }
}
