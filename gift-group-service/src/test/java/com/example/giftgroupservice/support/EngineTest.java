package com.example.giftgroupservice.support;

import com.example.giftgroupservice.service.impl.ClaimServiceImpl;
import com.example.giftgroupservice.service.impl.GiftListServiceImpl;
import com.example.giftgroupservice.service.impl.GroupLifecycleServiceImpl;
import com.example.giftgroupservice.service.impl.GroupServiceImpl;
import com.example.giftgroupservice.service.impl.MembershipServiceImpl;
import com.example.giftgroupservice.service.impl.UserServiceImpl;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * JPA slice (in-memory H2, schema from entities) with every service implementation and
 * the fixtures loaded. Each test runs in a transaction that is rolled back afterwards.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@DataJpaTest(properties = "spring.flyway.enabled=false")
@Import({
    GroupLifecycleServiceImpl.class,
    MembershipServiceImpl.class,
    ClaimServiceImpl.class,
    GiftListServiceImpl.class,
    GroupServiceImpl.class,
    UserServiceImpl.class,
    GiftGroupFixtures.class
})
public @interface EngineTest {
}
