package com.yerin.coursenotify.repository;

import com.yerin.coursenotify.domain.course.AppUser;
import com.yerin.coursenotify.domain.course.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {
    List<AppUser> findByRole(UserRole role);

    List<AppUser> findByRoleAndActiveTrue(UserRole role);
}
