/**
 * Jackson-backed codec implementations and the streaming JSON object framer
 * used on TCP connections.
 */
package com.questrail.hostbridge.codec.impl;
