package com.kendb3.profiles.model;

import com.kendb3.store.Model;

import lombok.Getter;
import lombok.Setter;

/**
 * Authentication account. Only the parts profiles need.
 */
@Getter
@Setter
public class User extends Model {
    private String username;
    private String firstName = "";
}
