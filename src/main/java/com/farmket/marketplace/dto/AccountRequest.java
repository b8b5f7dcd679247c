package com.farmket.marketplace.dto;

import com.farmket.marketplace.model.UserType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Input for account creation. The {@code staff}, {@code superuser} and {@code active} flags are
 * nullable: {@code null} means "not specified by the caller" and the service picks the default.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AccountRequest {
    private String email;
    @ToString.Exclude
    private String password;
    private UserType userType;
    private String firstName;
    private String lastName;
    private String phoneNumber;
    private String address;
    private String city;
    private String state;
    private Boolean staff;
    private Boolean superuser;
    private Boolean active;
    private Boolean verified;
}
