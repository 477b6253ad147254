/**
 * Implements the client side SASL mechanisms.
 *
 * <p>The following mechanisms are supported, strongest first:
 * <ul>
 *     <li>OAUTHBEARER</li>
 *     <li>XOAUTH2</li>
 *     <li>CRAM-MD5</li>
 *     <li>PLAIN</li>
 *     <li>LOGIN</li>
 * </ul>
 *
 * <p>The {@link com.mimecast.dispatch.smtp.auth.Authenticator} picks one and runs its exchange.
 */
package com.mimecast.dispatch.smtp.auth;
