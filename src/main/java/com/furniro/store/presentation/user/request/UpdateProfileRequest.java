package com.furniro.store.presentation.user.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 프로필 수정 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProfileRequest {

    @NotBlank(message = "이름(fname)은 필수입니다")
    private String fname;

    @NotBlank(message = "성(lname)은 필수입니다")
    private String lname;

    private String phone;
    private String bio;
    private String country;
    private String city;
}
