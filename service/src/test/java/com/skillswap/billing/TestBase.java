package com.skillswap.billing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillswap.billing.api.WebhookHeaders;
import com.skillswap.billing.gateway.PaymentGateway;
import com.skillswap.billing.model.SubscriptionPlan;
import com.skillswap.billing.model.UserAccount;
import com.skillswap.billing.repository.SubscriptionPlanRepository;
import com.skillswap.billing.repository.TransactionRepository;
import com.skillswap.billing.repository.UserAccountRepository;
import com.skillswap.billing.service.UserAccountService;
import com.skillswap.billing.support.MutableClock;
import com.skillswap.billing.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.RequestPostProcessor;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;

@SpringBootTest(
        classes = BillingApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"spring.main.allow-bean-definition-overriding=true"}
)
@AutoConfigureMockMvc
@Testcontainers
@Import(TestClockConfig.class)
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    protected static final String WEBHOOK_SECRET = TestProperties.WEBHOOK_SECRET;

    @MockBean
    protected PaymentGateway paymentGateway;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected UserAccountService userAccountService;

    @Autowired
    protected UserAccountRepository userAccountRepository;

    @Autowired
    protected TransactionRepository transactionRepository;

    @Autowired
    protected SubscriptionPlanRepository planRepository;

    @Autowired
    protected TransactionTemplate transactionTemplate;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    // Counter for generating unique user IDs in tests
    private static final AtomicLong userIdCounter = new AtomicLong(1_000);

    @BeforeEach
    void resetClock() {
        clock.setInstant(Instant.now());
    }

    /**
     * Creates a billing account with a fresh user ID.
     */
    protected Long createUser() {
        Long userId = userIdCounter.getAndIncrement();
        userAccountService.provision(userId, "user" + userId + "@example.com", "Test User " + userId);
        return userId;
    }

    /**
     * Creates a billing account and sets its wallet balance.
     */
    protected Long createUserWithBalance(long balance) {
        Long userId = createUser();
        updateUser(userId, user -> user.getWallet().setBalance(balance));
        return userId;
    }

    /**
     * Applies a change to a user row in its own transaction.
     */
    protected void updateUser(Long userId, Consumer<UserAccount> change) {
        transactionTemplate.executeWithoutResult(status -> {
            UserAccount user = userAccountRepository.findById(userId).orElseThrow();
            change.accept(user);
        });
    }

    protected UserAccount reloadUser(Long userId) {
        return userAccountRepository.findById(userId).orElseThrow();
    }

    protected SubscriptionPlan seededPlan(String name) {
        return planRepository.findAllByOrderBySortOrderAscPriceAsc().stream()
                .filter(plan -> plan.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    /**
     * Bearer token of the given user.
     */
    protected static RequestPostProcessor asUser(Long userId) {
        return jwt().jwt(token -> token.subject(String.valueOf(userId)));
    }

    protected static RequestPostProcessor asAdmin(Long userId) {
        return jwt().jwt(token -> token.subject(String.valueOf(userId)))
                .authorities(new SimpleGrantedAuthority("ROLE_ADMIN"));
    }

    /**
     * Token of a marketplace service acting for the given user.
     */
    protected static RequestPostProcessor asService(Long userId) {
        return jwt().jwt(token -> token.subject(String.valueOf(userId)))
                .authorities(new SimpleGrantedAuthority("ROLE_SERVICE"));
    }

    protected String toJson(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    /**
     * Posts a webhook and waits for the asynchronous processing, including retries.
     */
    protected ResultActions postWebhook(String path, String body, String signature) throws Exception {
        MvcResult started = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(WebhookHeaders.SIGNATURE, signature)
                        .content(body))
                .andExpect(request().asyncStarted())
                .andReturn();
        started.getAsyncResult(10_000);
        return mockMvc.perform(asyncDispatch(started));
    }

    protected static String chargeCompleted(String txRef, String providerId, String amount, String currency,
                                            String status) {
        return """
                {"event": "charge.completed",
                 "data": {"id": "%s", "tx_ref": "%s", "amount": %s, "currency": "%s", "status": "%s",
                          "narration": "test charge"}}
                """.formatted(providerId, txRef, amount, currency, status);
    }
}
