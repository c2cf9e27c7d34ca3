package org.pilot.usertransactions.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.pilot.usertransactions.entity.User;
import org.pilot.usertransactions.repository.UserRepository;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SeedUserInitializerTest {

    UserRepository userRepository;

    @BeforeEach
    void setUp() {
        userRepository = mock(UserRepository.class);
    }

    @Test
    void createsSampleUserWhenAbsent() {
        when(userRepository.findByUsername("john_doe")).thenReturn(Optional.empty());
        when(userRepository.save(any(User.class))).thenAnswer(i -> i.getArgument(0));

        new SeedUserInitializer(userRepository, true, "john_doe", "john@example.com", "password123").run();

        ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(saved.capture());
        assertThat(saved.getValue().getUsername()).isEqualTo("john_doe");
        assertThat(saved.getValue().getEmail()).isEqualTo("john@example.com");
        assertThat(saved.getValue().getPassword()).isEqualTo("password123");
    }

    @Test
    void skipsWhenUsernameAlreadyExists() {
        when(userRepository.findByUsername("john_doe")).thenReturn(Optional.of(new User("john_doe", "old@example.com", "x")));

        new SeedUserInitializer(userRepository, true, "john_doe", "john@example.com", "password123").run();

        verify(userRepository, never()).save(any());
    }

    @Test
    void doesNothingWhenDisabled() {
        new SeedUserInitializer(userRepository, false, "john_doe", "john@example.com", "password123").run();
        verifyNoInteractions(userRepository);
    }
}
