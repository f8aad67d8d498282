package com.example.eventrelay.config;

import com.example.eventrelay.model.DeliveryStatus;
import com.example.eventrelay.model.RetryBackoff;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC 配置。
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    /**
     * 查询参数中的枚举值不区分大小写，例如 status=pending。
     *
     * @param registry 转换器注册器
     */
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, DeliveryStatus.class,
                (Converter<String, DeliveryStatus>) source -> DeliveryStatus.valueOf(source.trim().toUpperCase()));
        registry.addConverter(String.class, RetryBackoff.class,
                (Converter<String, RetryBackoff>) source -> RetryBackoff.valueOf(source.trim().toUpperCase()));
    }
}
