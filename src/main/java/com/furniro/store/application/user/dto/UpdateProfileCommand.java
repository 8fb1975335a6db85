package com.furniro.store.application.user.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProfileCommand {
    private String fname;
    private String lname;
    private String phone;
    private String bio;
    private String country;
    private String city;
}
