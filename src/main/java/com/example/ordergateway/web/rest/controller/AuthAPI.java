package com.example.ordergateway.web.rest.controller;

import static com.example.ordergateway.web.rest.ApiConstants.ApiPath.*;

import com.example.ordergateway.domain.entity.UserAccount;
import com.example.ordergateway.web.rest.dto.UserResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@Tag(
    name = "Authentication",
    description = "Password login and current-user lookup"
)
@RequestMapping(
    value = AUTH_BASE,
    produces = MediaType.APPLICATION_JSON_VALUE
)
public interface AuthAPI {

  @Operation(
      summary = "Log in",
      description = "Exchanges form-encoded username and password for a bearer access token"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Access token issued"),
      @ApiResponse(responseCode = "401", description = "Incorrect username or password"),
      @ApiResponse(responseCode = "422", description = "Missing form fields")
  })
  @PostMapping(value = LOGIN, consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  ResponseEntity<?> login(
      @Parameter(description = "Username", required = true)
      @RequestParam String username,
      @Parameter(description = "Password", required = true)
      @RequestParam String password
                         );

  @Operation(
      summary = "Current user",
      description = "Returns the user the bearer token belongs to"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Authenticated user"),
      @ApiResponse(responseCode = "400", description = "Inactive user"),
      @ApiResponse(responseCode = "401", description = "Missing or invalid token")
  })
  @GetMapping(value = ME)
  ResponseEntity<UserResponse> me(@Parameter(hidden = true) @AuthenticationPrincipal UserAccount user);
}
