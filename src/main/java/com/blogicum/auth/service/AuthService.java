package com.blogicum.auth.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.blogicum.auth.config.AuthProperties;
import com.blogicum.auth.dto.LoginRequest;
import com.blogicum.auth.dto.LoginResponse;
import com.blogicum.auth.dto.RegisterRequest;
import com.blogicum.common.api.BlogException;
import com.blogicum.domain.entity.AccountEntity;
import com.blogicum.domain.mapper.AccountMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.regex.Pattern;

@Slf4j
@Service
public class AuthService {

    /** 字母、数字和 @ . + - _ */
    private static final Pattern USERNAME = Pattern.compile("^[\\w.@+-]{1,150}$");

    private final AccountMapper accountMapper;
    private final JwtService jwtService;
    private final AuthProperties props;
    private final BCryptPasswordEncoder passwordEncoder;
    private final Clock clock;

    public AuthService(
            AccountMapper accountMapper,
            JwtService jwtService,
            AuthProperties props,
            BCryptPasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.accountMapper = accountMapper;
        this.jwtService = jwtService;
        this.props = props;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    /**
     * 注册后直接登录，返回 accessToken。
     */
    public LoginResponse register(RegisterRequest request) {
        String username = request.username() == null ? "" : request.username().trim();
        if (!USERNAME.matcher(username).matches()) {
            throw BlogException.validation("bad_username");
        }
        if (findByUsername(username) != null) {
            throw BlogException.validation("username_taken");
        }

        AccountEntity account = AccountEntity.builder()
                .username(username)
                .passwordHash(passwordEncoder.encode(request.password()))
                .email(request.email() == null ? "" : request.email().trim())
                .firstName("")
                .lastName("")
                .isStaff(false)
                .createdAt(LocalDateTime.now(clock))
                .build();
        try {
            if (accountMapper.insert(account) != 1) {
                throw BlogException.validation("register_failed");
            }
        } catch (DuplicateKeyException e) {
            throw BlogException.validation("username_taken");
        }
        log.info("account registered: accountId={}, username={}", account.getId(), username);
        return issue(account);
    }

    public LoginResponse login(LoginRequest request) {
        String username = request.username() == null ? "" : request.username().trim();
        AccountEntity account = findByUsername(username);
        if (account == null
                || account.getPasswordHash() == null
                || !passwordEncoder.matches(request.password(), account.getPasswordHash())) {
            throw BlogException.validation("invalid_username_or_password");
        }
        return issue(account);
    }

    private LoginResponse issue(AccountEntity account) {
        boolean staff = Boolean.TRUE.equals(account.getIsStaff());
        String accessToken = jwtService.issueAccessToken(account.getId(), staff);
        return new LoginResponse(
                account.getId(),
                account.getUsername(),
                accessToken,
                props.accessTokenTtlSeconds()
        );
    }

    private AccountEntity findByUsername(String username) {
        return accountMapper.selectOne(new LambdaQueryWrapper<AccountEntity>()
                .eq(AccountEntity::getUsername, username)
                .last("LIMIT 1"));
    }
}
