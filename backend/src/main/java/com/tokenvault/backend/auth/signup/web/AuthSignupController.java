package com.tokenvault.backend.auth.signup.web;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.tokenvault.backend.auth.signup.dto.SignupRequest;
import com.tokenvault.backend.auth.signup.dto.SignupResponse;
import com.tokenvault.backend.auth.signup.service.SignupService;
import com.tokenvault.backend.auth.support.ClientInfoResolver;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthSignupController {

    private final SignupService signupService;
    private final ClientInfoResolver clientInfo;

    // POST /auth/signup -> 201
    @PostMapping("/signup")
    @ResponseStatus(HttpStatus.CREATED)
    public SignupResponse signup(@Valid @RequestBody SignupRequest req, HttpServletRequest request) {
        return signupService.register(req, clientInfo.clientIp(request));
    }
}
