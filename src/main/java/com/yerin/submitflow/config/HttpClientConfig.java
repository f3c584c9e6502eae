package com.yerin.submitflow.config;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean(name = "oracleHttpClient")
    public OkHttpClient oracleHttpClient(@Value("${submitflow.oracle.connect-timeout-ms:5000}") long connectTimeoutMs,
                                         @Value("${submitflow.oracle.read-timeout-ms:20000}") long readTimeoutMs) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                .addInterceptor(new LoggingInterceptor("Oracle"))
                .build();
    }

    @Bean(name = "captchaHttpClient")
    public OkHttpClient captchaHttpClient(@Value("${submitflow.captcha.timeout-ms:120000}") long timeoutMs) {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .addInterceptor(new LoggingInterceptor("Captcha"))
                .build();
    }

    static final class LoggingInterceptor implements Interceptor {
        private final String tag;

        LoggingInterceptor(String tag) {
            this.tag = tag;
        }

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            long start = System.nanoTime();
            try {
                Response response = chain.proceed(request);
                log.debug("[{}] {} {} -> {} ({}ms)", tag, request.method(), request.url(), response.code(),
                        (System.nanoTime() - start) / 1_000_000);
                return response;
            } catch (IOException e) {
                log.warn("[{}] {} {} failed ({}ms): {}", tag, request.method(), request.url(),
                        (System.nanoTime() - start) / 1_000_000, e.toString());
                throw e;
            }
        }
    }
}
