package com.example.eventrelay.security;

/**
 * 已解析的调用方身份，仅用于过滤与归属判断。
 */
public record Identity(String userId, String email, String name) {
}
