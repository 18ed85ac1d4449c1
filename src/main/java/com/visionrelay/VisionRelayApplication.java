package com.visionrelay;

import java.net.InetAddress;
import java.net.NetworkInterface;
import java.util.Enumeration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import com.visionrelay.config.VisionRelayProperties;

/**
 * Main application class for VisionRelay
 *
 * Pairs a phone camera with a desktop viewer over WebRTC:
 * - WebSocket signaling relay (join / offer / answer / ICE candidates) per room
 * - Optional server-side object detection on frames sent by the desktop
 * - Spring WebFlux on Netty for non-blocking socket handling
 */
@SpringBootApplication
public class VisionRelayApplication implements CommandLineRunner {

	private static final Logger logger = LoggerFactory.getLogger(VisionRelayApplication.class);

	private final VisionRelayProperties properties;

	@Value("${server.port:8080}")
	private int port;

	public VisionRelayApplication(VisionRelayProperties properties) {
		this.properties = properties;
	}

	public static void main(String[] args) {
		SpringApplication.run(VisionRelayApplication.class, args);
	}

	@Override
	public void run(String... args) {
		String path = properties.getWebsocket().getPath();
		logger.info("=================================");
		logger.info("VisionRelay Server Started");
		logger.info("Signaling endpoint: ws://localhost:{}{}", port, path);

		// Phones join over the LAN
		String networkIp = getNetworkIp();
		if (networkIp != null) {
			logger.info("Network access: ws://{}:{}{}", networkIp, port, path);
		} else {
			logger.info("Network IP not detected - check your WiFi connection");
		}
		logger.info("=================================");
	}

	/**
	 * Gets the network IP address for access from other devices
	 * @return Network IP address or null if not found
	 */
	private String getNetworkIp() {
		try {
			Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
			while (interfaces.hasMoreElements()) {
				NetworkInterface networkInterface = interfaces.nextElement();

				// Skip loopback and non-active interfaces
				if (networkInterface.isLoopback() || !networkInterface.isUp()) {
					continue;
				}

				Enumeration<InetAddress> addresses = networkInterface.getInetAddresses();
				while (addresses.hasMoreElements()) {
					InetAddress address = addresses.nextElement();
					if (!address.isLoopbackAddress() && address.isSiteLocalAddress()) {
						return address.getHostAddress();
					}
				}
			}
		} catch (Exception e) {
			logger.debug("Error detecting network IP: {}", e.getMessage());
		}
		return null;
	}
}
