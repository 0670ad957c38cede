package com.cinema.seatselection.websocket;

import lombok.Value;

@Value
public class AuthenticatedUser {

    Long userId;
    String email;
    String role;
}
