package com.yerin.coursenotify.notification;

import com.yerin.coursenotify.domain.course.AppUser;

public record Recipient(String email, String firstName, String lastName) {
    public static Recipient of(AppUser user) {
        return new Recipient(user.getEmail(), user.getFirstName(), user.getLastName());
    }
}
