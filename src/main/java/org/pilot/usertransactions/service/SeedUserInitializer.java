package org.pilot.usertransactions.service;

import org.pilot.usertransactions.entity.User;
import org.pilot.usertransactions.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the sample user once the schema is in place. Runs on every start and
 * only inserts when no user with the configured username exists.
 */
@Component
public class SeedUserInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SeedUserInitializer.class);

    private final UserRepository userRepository;
    private final boolean enabled;
    private final String username;
    private final String email;
    private final String password;

    public SeedUserInitializer(UserRepository userRepository,
                               @Value("${app.seed-user.enabled:true}") boolean enabled,
                               @Value("${app.seed-user.username:john_doe}") String username,
                               @Value("${app.seed-user.email:john@example.com}") String email,
                               @Value("${app.seed-user.password:password123}") String password) {
        this.userRepository = userRepository;
        this.enabled = enabled;
        this.username = username;
        this.email = email;
        this.password = password;
    }

    @Override
    @Transactional
    public void run(String... args) {
        if (!enabled) {
            log.info("Sample user seeding disabled (app.seed-user.enabled=false)");
            return;
        }
        if (userRepository.findByUsername(username).isPresent()) {
            log.debug("Sample user {} already present", username);
            return;
        }
        User user = userRepository.save(new User(username, email, password));
        log.info("Sample user created: {} (id {})", user.getUsername(), user.getId());
    }
}
