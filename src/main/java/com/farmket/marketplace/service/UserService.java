package com.farmket.marketplace.service;

import com.farmket.marketplace.dto.AccountRequest;
import com.farmket.marketplace.exception.ConfigurationException;
import com.farmket.marketplace.exception.ErrorCode;
import com.farmket.marketplace.exception.ResourceNotFoundException;
import com.farmket.marketplace.exception.UniquenessViolationException;
import com.farmket.marketplace.exception.ValidationException;
import com.farmket.marketplace.model.BuyerProfile;
import com.farmket.marketplace.model.SellerProfile;
import com.farmket.marketplace.model.User;
import com.farmket.marketplace.repository.BuyerProfileRepository;
import com.farmket.marketplace.repository.SellerProfileRepository;
import com.farmket.marketplace.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    /** Prefix of a stored password that can never match, see {@link #setPassword(User, String)}. */
    public static final String UNUSABLE_PASSWORD_PREFIX = "!";
    private static final int UNUSABLE_PASSWORD_SUFFIX_LENGTH = 40;
    private static final String RANDOM_CHARS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final Pattern PHONE_PATTERN = Pattern.compile(User.PHONE_REGEX);

    private final UserRepository userRepository;
    private final SellerProfileRepository sellerProfileRepository;
    private final BuyerProfileRepository buyerProfileRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuditService auditService;
    private final SecureRandom random = new SecureRandom();

    public UserService(UserRepository userRepository, SellerProfileRepository sellerProfileRepository,
            BuyerProfileRepository buyerProfileRepository, PasswordEncoder passwordEncoder,
            AuditService auditService) {
        this.userRepository = userRepository;
        this.sellerProfileRepository = sellerProfileRepository;
        this.buyerProfileRepository = buyerProfileRepository;
        this.passwordEncoder = passwordEncoder;
        this.auditService = auditService;
    }

    /**
     * Creates a regular account. The email is required and stored with a lower-cased domain; a
     * missing password leaves the account without a usable password.
     */
    @Transactional
    public User createUser(AccountRequest request) {
        if (request.getEmail() == null || request.getEmail().isEmpty()) {
            throw new ValidationException("Users must have an email address", ErrorCode.EMAIL_REQUIRED);
        }
        String email = normalizeEmail(request.getEmail());
        if (email.length() > User.MAX_EMAIL_LENGTH) {
            throw new ValidationException("Email must be at most " + User.MAX_EMAIL_LENGTH + " characters");
        }
        validatePhone(request.getPhoneNumber());
        if (userRepository.existsByEmail(email)) {
            throw new UniquenessViolationException("A user with email " + email + " already exists",
                    ErrorCode.EMAIL_ALREADY_EXISTS);
        }

        User user = new User();
        user.setEmail(email);
        user.setUserType(request.getUserType());
        user.setFirstName(orEmpty(request.getFirstName()));
        user.setLastName(orEmpty(request.getLastName()));
        user.setPhoneNumber(emptyToNull(request.getPhoneNumber()));
        user.setAddress(orEmpty(request.getAddress()));
        user.setCity(orEmpty(request.getCity()));
        user.setState(orEmpty(request.getState()));
        user.setActive(request.getActive() == null || request.getActive());
        user.setStaff(Boolean.TRUE.equals(request.getStaff()));
        user.setSuperuser(Boolean.TRUE.equals(request.getSuperuser()));
        user.setVerified(Boolean.TRUE.equals(request.getVerified()));
        setPassword(user, request.getPassword());

        User saved = write(user);
        log.info("Created {} account {}", saved.isSuperuser() ? "superuser" : "user", saved.getEmail());
        auditService.log("CREATE_USER", "User ID: " + saved.getId() + ", email: " + saved.getEmail());
        return saved;
    }

    /**
     * Creates an account with staff and superuser rights. Both flags default to true; passing
     * either one explicitly as false is a contradiction and fails.
     */
    @Transactional
    public User createSuperuser(AccountRequest request) {
        AccountRequest.AccountRequestBuilder builder = request.toBuilder();
        if (request.getStaff() == null) {
            builder.staff(true);
        }
        if (request.getSuperuser() == null) {
            builder.superuser(true);
        }
        if (request.getActive() == null) {
            builder.active(true);
        }
        AccountRequest resolved = builder.build();

        if (!Boolean.TRUE.equals(resolved.getStaff())) {
            throw new ConfigurationException("Superuser must have is_staff=True.");
        }
        if (!Boolean.TRUE.equals(resolved.getSuperuser())) {
            throw new ConfigurationException("Superuser must have is_superuser=True.");
        }
        return createUser(resolved);
    }

    /**
     * Strips surrounding whitespace and lower-cases the domain part of an address; the local part
     * is kept as typed. An address without {@code @} is only stripped.
     */
    public static String normalizeEmail(String email) {
        if (email == null) {
            return "";
        }
        String stripped = email.strip();
        int at = stripped.lastIndexOf('@');
        if (at < 0) {
            return stripped;
        }
        return stripped.substring(0, at) + "@" + stripped.substring(at + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Hashes and stores {@code rawPassword}. A {@code null} password stores an unusable marker so
     * that {@link #checkPassword(User, String)} fails until a real password is set.
     */
    public void setPassword(User user, String rawPassword) {
        if (rawPassword == null) {
            user.setPassword(UNUSABLE_PASSWORD_PREFIX + randomSuffix());
        } else {
            user.setPassword(passwordEncoder.encode(rawPassword));
        }
    }

    public boolean hasUsablePassword(User user) {
        return user.getPassword() != null && !user.getPassword().startsWith(UNUSABLE_PASSWORD_PREFIX);
    }

    public boolean checkPassword(User user, String rawPassword) {
        if (rawPassword == null || !hasUsablePassword(user)) {
            return false;
        }
        return passwordEncoder.matches(rawPassword, user.getPassword());
    }

    /**
     * Saves changes to an existing account, re-normalizing the email and re-validating the phone number.
     */
    @Transactional
    public User save(User user) {
        if (user.getEmail() == null || user.getEmail().isEmpty()) {
            throw new ValidationException("Users must have an email address", ErrorCode.EMAIL_REQUIRED);
        }
        user.setEmail(normalizeEmail(user.getEmail()));
        validatePhone(user.getPhoneNumber());
        return write(user);
    }

    public User get(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User not found: " + id, ErrorCode.USER_NOT_FOUND));
    }

    /**
     * Attaches a seller profile to the user. The user's {@code userType} is not consulted.
     */
    @Transactional
    public SellerProfile createSellerProfile(Long userId, String businessName) {
        if (businessName == null || businessName.isBlank()) {
            throw new ValidationException("Business name is required");
        }
        if (businessName.length() > SellerProfile.MAX_BUSINESS_NAME_LENGTH) {
            throw new ValidationException("Business name must be at most "
                    + SellerProfile.MAX_BUSINESS_NAME_LENGTH + " characters");
        }
        if (sellerProfileRepository.existsByBusinessName(businessName)) {
            throw new UniquenessViolationException("Business name '" + businessName + "' is already in use");
        }
        SellerProfile profile = new SellerProfile();
        profile.setUser(get(userId));
        profile.setBusinessName(businessName);
        try {
            return sellerProfileRepository.saveAndFlush(profile);
        } catch (DataIntegrityViolationException e) {
            throw new UniquenessViolationException("User " + userId + " already has a seller profile or business name '"
                    + businessName + "' is taken", e);
        }
    }

    @Transactional
    public BuyerProfile createBuyerProfile(Long userId, List<Long> preferredCategories) {
        BuyerProfile profile = new BuyerProfile();
        profile.setUser(get(userId));
        if (preferredCategories != null) {
            profile.getPreferredCategories().addAll(preferredCategories);
        }
        try {
            return buyerProfileRepository.saveAndFlush(profile);
        } catch (DataIntegrityViolationException e) {
            throw new UniquenessViolationException("User " + userId + " already has a buyer profile", e);
        }
    }

    /**
     * Deletes the account. Its seller/buyer profile, and through the seller profile its products,
     * are removed by the cascading foreign keys.
     */
    @Transactional
    public void delete(Long userId) {
        User user = get(userId);
        userRepository.delete(user);
        userRepository.flush();
        log.info("Deleted user {} ({})", userId, user.getEmail());
        auditService.log("DELETE_USER", "User ID: " + userId + ", email: " + user.getEmail());
    }

    private User write(User user) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new UniquenessViolationException("Email " + user.getEmail() + " is already in use", e);
        }
    }

    private void validatePhone(String phoneNumber) {
        if (phoneNumber != null && !phoneNumber.isEmpty() && !PHONE_PATTERN.matcher(phoneNumber).matches()) {
            throw new ValidationException(User.PHONE_ERROR_MESSAGE, ErrorCode.INVALID_PHONE_NUMBER);
        }
    }

    private String randomSuffix() {
        StringBuilder sb = new StringBuilder(UNUSABLE_PASSWORD_SUFFIX_LENGTH);
        for (int i = 0; i < UNUSABLE_PASSWORD_SUFFIX_LENGTH; i++) {
            sb.append(RANDOM_CHARS.charAt(random.nextInt(RANDOM_CHARS.length())));
        }
        return sb.toString();
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
