package com.farmket.marketplace.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Marketplace account. The email address is the login identifier; there is no username.
 * A user is either a buyer or a seller, see {@link #isBuyer()} and {@link #isSeller()}.
 */
@Entity
@Table(name = "users", indexes = {
        @Index(name = "idx_user_email_type", columnList = "email, user_type"),
        @Index(name = "idx_user_type_active", columnList = "user_type, active"),
        @Index(name = "idx_user_city_type", columnList = "city, user_type")
})
@Data
public class User {

    public static final int MAX_EMAIL_LENGTH = 254;
    public static final int MAX_NAME_LENGTH = 150;
    public static final int MAX_PHONE_LENGTH = 17;
    public static final String PHONE_REGEX = "^\\+?1?\\d{9,15}$";
    public static final String PHONE_ERROR_MESSAGE =
            "Phone number must be entered in the format: '+999999999'. Up to 15 digits allowed.";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = MAX_EMAIL_LENGTH)
    private String email;

    @ToString.Exclude
    @Column(nullable = false, length = 128)
    private String password;

    @Enumerated(EnumType.STRING)
    @Column(name = "user_type", length = 10)
    private UserType userType;

    @Column(nullable = false, length = MAX_NAME_LENGTH)
    private String firstName = "";

    @Column(nullable = false, length = MAX_NAME_LENGTH)
    private String lastName = "";

    @Column(length = MAX_PHONE_LENGTH)
    private String phoneNumber;

    private String profilePicture;

    // Address
    private String address = "";
    @Column(length = 100)
    private String city = "";
    @Column(length = 100)
    private String state = "";

    private boolean active = true;
    private boolean staff = false;
    private boolean superuser = false;
    private boolean verified = false;

    @Column(updatable = false)
    private LocalDateTime dateJoined;

    private LocalDateTime lastLogin;

    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (dateJoined == null) {
            dateJoined = LocalDateTime.now();
        }
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isBuyer() {
        return userType == UserType.BUYER;
    }

    public boolean isSeller() {
        return userType == UserType.SELLER;
    }

    public String getFullName() {
        return (nullToEmpty(firstName) + " " + nullToEmpty(lastName)).trim();
    }

    public String getShortName() {
        return firstName;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
