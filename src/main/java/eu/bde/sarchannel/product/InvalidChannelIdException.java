package eu.bde.sarchannel.product;

public class InvalidChannelIdException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String channelId;

	public InvalidChannelIdException(String channelId, String message) {
		super(message);
		this.channelId = channelId;
	}

	public String getChannelId() {
		return channelId;
	}
}
