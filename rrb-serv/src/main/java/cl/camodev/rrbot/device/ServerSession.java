package cl.camodev.rrbot.device;

/**
 * Host side adb server session kept alive for the lifetime of the process.
 */
public interface ServerSession {

	ServerSession NONE = new ServerSession() {
		@Override
		public void start() {
		}

		@Override
		public void restart() {
		}

		@Override
		public void shutdown() {
		}

		@Override
		public boolean isConnected() {
			return false;
		}
	};

	void start();

	void restart();

	void shutdown();

	boolean isConnected();
}
