package com.engagesphere.booster.application;

import com.engagesphere.booster.domain.exception.EmailAlreadyRegisteredException;
import com.engagesphere.booster.domain.exception.UserNotFoundException;
import com.engagesphere.booster.domain.model.ContactMethod;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.domain.port.out.UserRepository;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class UserAccountUseCase implements ManageUsers {

    private static final Logger logger = LoggerFactory.getLogger(UserAccountUseCase.class);

    private final UserRepository userRepository;

    public UserAccountUseCase(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public User create(User user) {
        if (userRepository.findByEmail(user.email()).isPresent()) {
            throw new EmailAlreadyRegisteredException(user.email());
        }

        boolean firstUser = userRepository.count() == 0;
        String contactMethod = user.preferredContactMethod() == null
                ? ContactMethod.EMAIL.value()
                : user.preferredContactMethod();
        User saved = userRepository.save(new User(null, user.email(), user.name(), user.jobTitle(),
                user.interests(), contactMethod, user.phoneNumber(), firstUser));

        if (firstUser) {
            logger.info("First user created ({}) and granted admin privileges", saved.email());
        } else {
            logger.info("Created user {}", saved.email());
        }
        return saved;
    }

    @Override
    public User findOrCreate(User user) {
        return userRepository.findByEmail(user.email())
                .orElseGet(() -> create(user));
    }

    @Override
    public Optional<User> findById(long userId) {
        return userRepository.findById(userId);
    }

    @Override
    public User updateContact(long userId, String preferredContactMethod, String phoneNumber) {
        User user = userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
        userRepository.updateContact(userId, preferredContactMethod, phoneNumber);
        logger.info("Updated contact preference of user {} to {}", userId, preferredContactMethod);
        return user.withContact(preferredContactMethod, phoneNumber);
    }
}
