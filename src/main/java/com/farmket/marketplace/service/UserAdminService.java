package com.farmket.marketplace.service;

import com.farmket.marketplace.model.User;
import com.farmket.marketplace.model.UserType;
import com.farmket.marketplace.repository.UserRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;

@Service
@Transactional(readOnly = true)
public class UserAdminService {

    private final UserRepository userRepository;

    public UserAdminService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * Lists accounts, most recently joined first. {@code query} matches email, first and last name.
     */
    public List<User> search(String query, Boolean staff, Boolean active, UserType userType) {
        Specification<User> spec = Specification.where(matchesQuery(query))
                .and(flag("staff", staff))
                .and(flag("active", active))
                .and(userType == null ? null : (root, cq, cb) -> cb.equal(root.get("userType"), userType));
        return userRepository.findAll(spec, Sort.by(Sort.Direction.DESC, "dateJoined"));
    }

    private static Specification<User> matchesQuery(String query) {
        if (query == null || query.isBlank()) {
            return null;
        }
        String pattern = "%" + query.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, cq, cb) -> cb.or(
                cb.like(cb.lower(root.get("email")), pattern),
                cb.like(cb.lower(root.get("firstName")), pattern),
                cb.like(cb.lower(root.get("lastName")), pattern));
    }

    private static Specification<User> flag(String attribute, Boolean value) {
        return value == null ? null : (root, cq, cb) -> cb.equal(root.get(attribute), value);
    }
}
